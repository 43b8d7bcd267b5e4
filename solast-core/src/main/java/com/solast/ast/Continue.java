package com.solast.ast;

public record Continue(
    long id,
    SourceLocation location
) implements Statement {
    public Continue(SourceLocation location) {
        this(NodeIds.next(), location);
    }

    @Override
    public String nodeType() {
        return "Continue";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
