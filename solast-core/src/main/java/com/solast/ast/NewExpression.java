package com.solast.ast;

public record NewExpression(
    long id,
    SourceLocation location,
    TypeName typeName,
    ExpressionAnnotation annotation
) implements Expression {
    public NewExpression(SourceLocation location, TypeName typeName, ExpressionAnnotation annotation) {
        this(NodeIds.next(), location, typeName, annotation);
    }

    @Override
    public String nodeType() {
        return "NewExpression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
