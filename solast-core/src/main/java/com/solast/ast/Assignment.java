package com.solast.ast;

public record Assignment(
    long id,
    SourceLocation location,
    Expression leftHandSide,
    Token operator,
    Expression rightHandSide,
    ExpressionAnnotation annotation
) implements Expression {
    public Assignment(
        SourceLocation location,
        Expression leftHandSide,
        Token operator,
        Expression rightHandSide,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, leftHandSide, operator, rightHandSide, annotation);
    }

    @Override
    public String nodeType() {
        return "Assignment";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
