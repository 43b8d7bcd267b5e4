package com.solast.ast;

import java.util.List;

public record Block(
    long id,
    SourceLocation location,
    List<Statement> statements
) implements Statement {
    public Block(SourceLocation location, List<Statement> statements) {
        this(NodeIds.next(), location, statements);
    }

    @Override
    public String nodeType() {
        return "Block";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
