package com.solast.ast;

public record ElementaryTypeName(
    long id,
    SourceLocation location,
    String name
) implements TypeName {
    public ElementaryTypeName(SourceLocation location, String name) {
        this(NodeIds.next(), location, name);
    }

    @Override
    public String nodeType() {
        return "ElementaryTypeName";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
