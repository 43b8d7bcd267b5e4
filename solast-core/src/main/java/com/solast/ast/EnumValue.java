package com.solast.ast;

public record EnumValue(
    long id,
    SourceLocation location,
    String name,
    NodeRef scope
) implements Declaration {
    public EnumValue(SourceLocation location, String name, NodeRef scope) {
        this(NodeIds.next(), location, name, scope);
    }

    @Override
    public String nodeType() {
        return "EnumValue";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
