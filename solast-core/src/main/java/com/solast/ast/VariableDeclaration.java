package com.solast.ast;

public record VariableDeclaration(
    long id,
    SourceLocation location,
    TypeName typeName,  // null for "var"
    String name,
    Expression value,  // Can be null
    Visibility visibility,
    boolean isIndexed,
    boolean isConstant,
    StorageLocation storageLocation,
    NodeRef scope,
    ResolvedType type  // null if analysis did not resolve it
) implements Declaration {
    public VariableDeclaration(
        SourceLocation location,
        TypeName typeName,
        String name,
        Expression value,
        Visibility visibility,
        boolean isIndexed,
        boolean isConstant,
        StorageLocation storageLocation,
        NodeRef scope,
        ResolvedType type
    ) {
        this(NodeIds.next(), location, typeName, name, value, visibility, isIndexed, isConstant, storageLocation, scope, type);
    }

    @Override
    public String nodeType() {
        return "VariableDeclaration";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
