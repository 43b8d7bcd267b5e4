package com.solast.ast;

import java.util.List;

public record StructDefinition(
    long id,
    SourceLocation location,
    String name,
    Visibility visibility,
    List<VariableDeclaration> members,
    NodeRef scope,
    TypeDeclarationAnnotation annotation
) implements Declaration {
    public StructDefinition(
        SourceLocation location,
        String name,
        Visibility visibility,
        List<VariableDeclaration> members,
        NodeRef scope,
        TypeDeclarationAnnotation annotation
    ) {
        this(NodeIds.next(), location, name, visibility, members, scope, annotation);
    }

    @Override
    public String nodeType() {
        return "StructDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
