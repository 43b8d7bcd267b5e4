package com.solast.ast;

public record ForStatement(
    long id,
    SourceLocation location,
    Statement initExpression,  // Can be null
    Expression condition,  // Can be null
    ExpressionStatement loopExpression,  // Can be null
    Statement body
) implements Statement {
    public ForStatement(
        SourceLocation location,
        Statement initExpression,
        Expression condition,
        ExpressionStatement loopExpression,
        Statement body
    ) {
        this(NodeIds.next(), location, initExpression, condition, loopExpression, body);
    }

    @Override
    public String nodeType() {
        return "ForStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
