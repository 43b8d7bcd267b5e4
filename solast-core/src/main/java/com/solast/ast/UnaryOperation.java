package com.solast.ast;

public record UnaryOperation(
    long id,
    SourceLocation location,
    Token operator,
    Expression subExpression,
    boolean isPrefix,
    ExpressionAnnotation annotation
) implements Expression {
    public UnaryOperation(
        SourceLocation location,
        Token operator,
        Expression subExpression,
        boolean isPrefix,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, operator, subExpression, isPrefix, annotation);
    }

    @Override
    public String nodeType() {
        return "UnaryOperation";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
