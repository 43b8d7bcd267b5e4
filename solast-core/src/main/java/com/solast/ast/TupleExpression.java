package com.solast.ast;

import java.util.List;

public record TupleExpression(
    long id,
    SourceLocation location,
    List<Expression> components,  // entries are null for empty components
    boolean isInlineArray,
    ExpressionAnnotation annotation
) implements Expression {
    public TupleExpression(
        SourceLocation location,
        List<Expression> components,
        boolean isInlineArray,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, components, isInlineArray, annotation);
    }

    @Override
    public String nodeType() {
        return "TupleExpression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
