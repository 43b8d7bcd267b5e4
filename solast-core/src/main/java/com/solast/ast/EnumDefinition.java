package com.solast.ast;

import java.util.List;

public record EnumDefinition(
    long id,
    SourceLocation location,
    String name,
    Visibility visibility,
    List<EnumValue> members,
    NodeRef scope,
    TypeDeclarationAnnotation annotation
) implements Declaration {
    public EnumDefinition(
        SourceLocation location,
        String name,
        Visibility visibility,
        List<EnumValue> members,
        NodeRef scope,
        TypeDeclarationAnnotation annotation
    ) {
        this(NodeIds.next(), location, name, visibility, members, scope, annotation);
    }

    @Override
    public String nodeType() {
        return "EnumDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
