package com.solast.ast;

public record InlineAssembly(
    long id,
    SourceLocation location,
    String operations
) implements Statement {
    public InlineAssembly(SourceLocation location, String operations) {
        this(NodeIds.next(), location, operations);
    }

    @Override
    public String nodeType() {
        return "InlineAssembly";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
