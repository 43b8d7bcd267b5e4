package com.solast.ast;

import java.util.List;

public record UserDefinedTypeName(
    long id,
    SourceLocation location,
    List<String> namePath,
    UserDefinedTypeNameAnnotation annotation
) implements TypeName {
    public UserDefinedTypeName(SourceLocation location, List<String> namePath, UserDefinedTypeNameAnnotation annotation) {
        this(NodeIds.next(), location, namePath, annotation);
    }

    @Override
    public String nodeType() {
        return "UserDefinedTypeName";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
