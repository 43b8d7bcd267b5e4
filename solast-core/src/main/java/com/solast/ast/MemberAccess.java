package com.solast.ast;

public record MemberAccess(
    long id,
    SourceLocation location,
    Expression expression,
    String memberName,
    NodeRef referencedDeclaration,  // Can be null
    ExpressionAnnotation annotation
) implements Expression {
    public MemberAccess(
        SourceLocation location,
        Expression expression,
        String memberName,
        NodeRef referencedDeclaration,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, expression, memberName, referencedDeclaration, annotation);
    }

    @Override
    public String nodeType() {
        return "MemberAccess";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
