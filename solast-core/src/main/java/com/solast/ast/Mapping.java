package com.solast.ast;

public record Mapping(
    long id,
    SourceLocation location,
    ElementaryTypeName keyType,
    TypeName valueType
) implements TypeName {
    public Mapping(SourceLocation location, ElementaryTypeName keyType, TypeName valueType) {
        this(NodeIds.next(), location, keyType, valueType);
    }

    @Override
    public String nodeType() {
        return "Mapping";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
