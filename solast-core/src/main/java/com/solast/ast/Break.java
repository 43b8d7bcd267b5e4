package com.solast.ast;

public record Break(
    long id,
    SourceLocation location
) implements Statement {
    public Break(SourceLocation location) {
        this(NodeIds.next(), location);
    }

    @Override
    public String nodeType() {
        return "Break";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
