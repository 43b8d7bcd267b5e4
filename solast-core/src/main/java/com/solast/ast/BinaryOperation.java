package com.solast.ast;

public record BinaryOperation(
    long id,
    SourceLocation location,
    Expression leftExpression,
    Token operator,
    Expression rightExpression,
    ResolvedType commonType,
    ExpressionAnnotation annotation
) implements Expression {
    public BinaryOperation(
        SourceLocation location,
        Expression leftExpression,
        Token operator,
        Expression rightExpression,
        ResolvedType commonType,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, leftExpression, operator, rightExpression, commonType, annotation);
    }

    @Override
    public String nodeType() {
        return "BinaryOperation";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
