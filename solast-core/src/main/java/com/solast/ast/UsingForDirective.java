package com.solast.ast;

public record UsingForDirective(
    long id,
    SourceLocation location,
    UserDefinedTypeName libraryName,
    TypeName typeName  // null for "using L for *"
) implements Node {
    public UsingForDirective(SourceLocation location, UserDefinedTypeName libraryName, TypeName typeName) {
        this(NodeIds.next(), location, libraryName, typeName);
    }

    @Override
    public String nodeType() {
        return "UsingForDirective";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
