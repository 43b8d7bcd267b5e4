package com.solast.ast;

public record Return(
    long id,
    SourceLocation location,
    Expression expression,  // Can be null
    ReturnAnnotation annotation
) implements Statement {
    public Return(SourceLocation location, Expression expression, ReturnAnnotation annotation) {
        this(NodeIds.next(), location, expression, annotation);
    }

    @Override
    public String nodeType() {
        return "Return";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
