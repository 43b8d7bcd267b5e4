package com.solast.ast;

import java.util.List;

public record ContractDefinition(
    long id,
    SourceLocation location,
    String name,
    boolean isLibrary,
    List<InheritanceSpecifier> baseContracts,
    List<Node> subNodes,
    NodeRef scope,
    ContractAnnotation annotation
) implements Declaration {
    public ContractDefinition(
        SourceLocation location,
        String name,
        boolean isLibrary,
        List<InheritanceSpecifier> baseContracts,
        List<Node> subNodes,
        NodeRef scope,
        ContractAnnotation annotation
    ) {
        this(NodeIds.next(), location, name, isLibrary, baseContracts, subNodes, scope, annotation);
    }

    @Override
    public String nodeType() {
        return "ContractDefinition";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
