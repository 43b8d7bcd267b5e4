package com.solast.ast;

import java.util.List;

public record FunctionDefinition(
    long id,
    SourceLocation location,
    String name,
    Visibility visibility,
    boolean isConstructor,
    boolean isDeclaredConst,
    boolean isPayable,
    ParameterList parameters,
    ParameterList returnParameters,
    List<ModifierInvocation> modifiers,
    Block body,  // null when the function is not implemented
    NodeRef scope
) implements Declaration {
    public FunctionDefinition(
        SourceLocation location,
        String name,
        Visibility visibility,
        boolean isConstructor,
        boolean isDeclaredConst,
        boolean isPayable,
        ParameterList parameters,
        ParameterList returnParameters,
        List<ModifierInvocation> modifiers,
        Block body,
        NodeRef scope
    ) {
        this(NodeIds.next(), location, name, visibility, isConstructor, isDeclaredConst, isPayable, parameters, returnParameters, modifiers, body, scope);
    }

    public boolean isImplemented() {
        return body != null;
    }

    @Override
    public String nodeType() {
        return "FunctionDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
