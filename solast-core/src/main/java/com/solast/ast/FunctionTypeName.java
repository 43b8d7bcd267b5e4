package com.solast.ast;

public record FunctionTypeName(
    long id,
    SourceLocation location,
    ParameterList parameterTypes,
    ParameterList returnParameterTypes,
    Visibility visibility,
    boolean isDeclaredConst,
    boolean isPayable
) implements TypeName {
    public FunctionTypeName(
        SourceLocation location,
        ParameterList parameterTypes,
        ParameterList returnParameterTypes,
        Visibility visibility,
        boolean isDeclaredConst,
        boolean isPayable
    ) {
        this(NodeIds.next(), location, parameterTypes, returnParameterTypes, visibility, isDeclaredConst, isPayable);
    }

    @Override
    public String nodeType() {
        return "FunctionTypeName";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
