package com.solast.ast;

public record IndexAccess(
    long id,
    SourceLocation location,
    Expression baseExpression,
    Expression indexExpression,  // Can be null
    ExpressionAnnotation annotation
) implements Expression {
    public IndexAccess(
        SourceLocation location,
        Expression baseExpression,
        Expression indexExpression,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, baseExpression, indexExpression, annotation);
    }

    @Override
    public String nodeType() {
        return "IndexAccess";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
