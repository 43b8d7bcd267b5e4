package com.solast.ast;

import java.util.List;

public record InheritanceSpecifier(
    long id,
    SourceLocation location,
    UserDefinedTypeName baseName,
    List<Expression> arguments
) implements Node {
    public InheritanceSpecifier(SourceLocation location, UserDefinedTypeName baseName, List<Expression> arguments) {
        this(NodeIds.next(), location, baseName, arguments);
    }

    @Override
    public String nodeType() {
        return "InheritanceSpecifier";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
