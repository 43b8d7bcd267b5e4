package com.solast.ast;

/**
 * The {@code _} inside a modifier body.
 */
public record PlaceholderStatement(
    long id,
    SourceLocation location
) implements Statement {
    public PlaceholderStatement(SourceLocation location) {
        this(NodeIds.next(), location);
    }

    @Override
    public String nodeType() {
        return "PlaceholderStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
