package com.solast.ast;

public record WhileStatement(
    long id,
    SourceLocation location,
    Expression condition,
    Statement body,
    boolean isDoWhile
) implements Statement {
    public WhileStatement(
        SourceLocation location,
        Expression condition,
        Statement body,
        boolean isDoWhile
    ) {
        this(NodeIds.next(), location, condition, body, isDoWhile);
    }

    @Override
    public String nodeType() {
        return isDoWhile ? "DoWhileStatement" : "WhileStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
