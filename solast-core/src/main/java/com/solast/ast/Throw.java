package com.solast.ast;

public record Throw(
    long id,
    SourceLocation location
) implements Statement {
    public Throw(SourceLocation location) {
        this(NodeIds.next(), location);
    }

    @Override
    public String nodeType() {
        return "Throw";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
