package com.solast.ast;

import java.util.List;

public record VariableDeclarationStatement(
    long id,
    SourceLocation location,
    List<VariableDeclaration> declarations,  // entries are null for skipped tuple components
    Expression initialValue,  // Can be null
    VariableDeclarationStatementAnnotation annotation
) implements Statement {
    public VariableDeclarationStatement(
        SourceLocation location,
        List<VariableDeclaration> declarations,
        Expression initialValue,
        VariableDeclarationStatementAnnotation annotation
    ) {
        this(NodeIds.next(), location, declarations, initialValue, annotation);
    }

    @Override
    public String nodeType() {
        return "VariableDeclarationStatement";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
