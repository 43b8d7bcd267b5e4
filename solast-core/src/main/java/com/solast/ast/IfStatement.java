package com.solast.ast;

public record IfStatement(
    long id,
    SourceLocation location,
    Expression condition,
    Statement trueBody,
    Statement falseBody  // Can be null
) implements Statement {
    public IfStatement(
        SourceLocation location,
        Expression condition,
        Statement trueBody,
        Statement falseBody
    ) {
        this(NodeIds.next(), location, condition, trueBody, falseBody);
    }

    @Override
    public String nodeType() {
        return "IfStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
