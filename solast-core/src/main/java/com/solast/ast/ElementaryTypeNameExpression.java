package com.solast.ast;

/**
 * An elementary type used as an expression, e.g. the callee in {@code uint(x)}.
 */
public record ElementaryTypeNameExpression(
    long id,
    SourceLocation location,
    String typeName,
    ExpressionAnnotation annotation
) implements Expression {
    public ElementaryTypeNameExpression(SourceLocation location, String typeName, ExpressionAnnotation annotation) {
        this(NodeIds.next(), location, typeName, annotation);
    }

    @Override
    public String nodeType() {
        return "ElementaryTypeNameExpression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
