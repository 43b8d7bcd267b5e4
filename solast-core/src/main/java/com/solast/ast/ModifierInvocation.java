package com.solast.ast;

import java.util.List;

public record ModifierInvocation(
    long id,
    SourceLocation location,
    Identifier modifierName,
    List<Expression> arguments
) implements Node {
    public ModifierInvocation(SourceLocation location, Identifier modifierName, List<Expression> arguments) {
        this(NodeIds.next(), location, modifierName, arguments);
    }

    @Override
    public String nodeType() {
        return "ModifierInvocation";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
