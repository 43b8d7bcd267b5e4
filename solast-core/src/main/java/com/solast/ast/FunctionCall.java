package com.solast.ast;

import java.util.List;

public record FunctionCall(
    long id,
    SourceLocation location,
    Expression expression,
    List<Expression> arguments,
    List<String> names,  // named-argument names, empty for positional calls
    boolean isTypeConversion,
    boolean isStructConstructorCall,
    ExpressionAnnotation annotation
) implements Expression {
    public FunctionCall(
        SourceLocation location,
        Expression expression,
        List<Expression> arguments,
        List<String> names,
        boolean isTypeConversion,
        boolean isStructConstructorCall,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, expression, arguments, names, isTypeConversion, isStructConstructorCall, annotation);
    }

    @Override
    public String nodeType() {
        return "FunctionCall";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
