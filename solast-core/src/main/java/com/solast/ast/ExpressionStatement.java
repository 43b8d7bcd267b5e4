package com.solast.ast;

public record ExpressionStatement(
    long id,
    SourceLocation location,
    Expression expression
) implements Statement {
    public ExpressionStatement(SourceLocation location, Expression expression) {
        this(NodeIds.next(), location, expression);
    }

    @Override
    public String nodeType() {
        return "ExpressionStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
