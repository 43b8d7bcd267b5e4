package com.solast.ast;

import java.util.List;

public record Identifier(
    long id,
    SourceLocation location,
    String name,
    NodeRef referencedDeclaration,  // Can be null
    List<NodeRef> overloadedDeclarations,
    ExpressionAnnotation annotation
) implements Expression {
    public Identifier(
        SourceLocation location,
        String name,
        NodeRef referencedDeclaration,
        List<NodeRef> overloadedDeclarations,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, name, referencedDeclaration, overloadedDeclarations, annotation);
    }

    @Override
    public String nodeType() {
        return "Identifier";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
