package com.solast.ast;

public record Conditional(
    long id,
    SourceLocation location,
    Expression condition,
    Expression trueExpression,
    Expression falseExpression,
    ExpressionAnnotation annotation
) implements Expression {
    public Conditional(
        SourceLocation location,
        Expression condition,
        Expression trueExpression,
        Expression falseExpression,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, condition, trueExpression, falseExpression, annotation);
    }

    @Override
    public String nodeType() {
        return "Conditional";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
