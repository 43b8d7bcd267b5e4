package com.solast.ast;

import java.util.List;

/**
 * {@code import "path" as unitAlias;} or {@code import {a as b} from "path";}
 */
public record ImportDirective(
    long id,
    SourceLocation location,
    String path,
    String unitAlias,
    List<SymbolAlias> symbolAliases,
    NodeRef scope,
    ImportAnnotation annotation
) implements Declaration {
    public ImportDirective(
        SourceLocation location,
        String path,
        String unitAlias,
        List<SymbolAlias> symbolAliases,
        NodeRef scope,
        ImportAnnotation annotation
    ) {
        this(NodeIds.next(), location, path, unitAlias, symbolAliases, scope, annotation);
    }

    @Override
    public String name() {
        return unitAlias;
    }

    /**
     * One entry of an import's symbol list.
     *
     * @param foreign the imported symbol as written
     * @param local the local alias, or null if none was given
     */
    public record SymbolAlias(Identifier foreign, String local) {}

    @Override
    public String nodeType() {
        return "ImportDirective";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
