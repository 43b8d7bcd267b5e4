package com.solast.ast;

import java.util.List;

public record ParameterList(
    long id,
    SourceLocation location,
    List<VariableDeclaration> parameters
) implements Node {
    public ParameterList(SourceLocation location, List<VariableDeclaration> parameters) {
        this(NodeIds.next(), location, parameters);
    }

    @Override
    public String nodeType() {
        return "ParameterList";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
