package com.solast.ast;

public record ArrayTypeName(
    long id,
    SourceLocation location,
    TypeName baseType,
    Expression length  // null for dynamic arrays
) implements TypeName {
    public ArrayTypeName(SourceLocation location, TypeName baseType, Expression length) {
        this(NodeIds.next(), location, baseType, length);
    }

    @Override
    public String nodeType() {
        return "ArrayTypeName";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
