package com.solast.ast;

import java.util.List;

public record PragmaDirective(
    long id,
    SourceLocation location,
    List<String> literals
) implements Node {
    public PragmaDirective(SourceLocation location, List<String> literals) {
        this(NodeIds.next(), location, literals);
    }

    @Override
    public String nodeType() {
        return "PragmaDirective";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
