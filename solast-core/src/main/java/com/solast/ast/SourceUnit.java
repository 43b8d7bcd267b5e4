package com.solast.ast;

import java.util.List;

/**
 * Root of one source file.
 */
public record SourceUnit(
    long id,
    SourceLocation location,
    List<Node> nodes,
    SourceUnitAnnotation annotation
) implements Node {
    public SourceUnit(SourceLocation location, List<Node> nodes, SourceUnitAnnotation annotation) {
        this(NodeIds.next(), location, nodes, annotation);
    }

    @Override
    public String nodeType() {
        return "SourceUnit";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
