package com.solast.ast;

import java.util.List;

public record ContractAnnotation(
    boolean isFullyImplemented,
    List<NodeRef> linearizedBaseContracts,
    List<NodeRef> contractDependencies
) {
}
