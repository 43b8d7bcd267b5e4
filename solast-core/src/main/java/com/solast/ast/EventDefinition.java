package com.solast.ast;

public record EventDefinition(
    long id,
    SourceLocation location,
    String name,
    ParameterList parameters,
    boolean isAnonymous,
    NodeRef scope
) implements Declaration {
    public EventDefinition(
        SourceLocation location,
        String name,
        ParameterList parameters,
        boolean isAnonymous,
        NodeRef scope
    ) {
        this(NodeIds.next(), location, name, parameters, isAnonymous, scope);
    }

    @Override
    public String nodeType() {
        return "EventDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
