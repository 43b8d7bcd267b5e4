package com.solast.ast;

public record ModifierDefinition(
    long id,
    SourceLocation location,
    String name,
    Visibility visibility,
    ParameterList parameters,
    Block body,
    NodeRef scope
) implements Declaration {
    public ModifierDefinition(
        SourceLocation location,
        String name,
        Visibility visibility,
        ParameterList parameters,
        Block body,
        NodeRef scope
    ) {
        this(NodeIds.next(), location, name, visibility, parameters, body, scope);
    }

    @Override
    public String nodeType() {
        return "ModifierDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
