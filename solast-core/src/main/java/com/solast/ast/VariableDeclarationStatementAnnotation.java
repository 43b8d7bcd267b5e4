package com.solast.ast;

import java.util.List;

/**
 * @param assignments the declaration each tuple component is assigned to; null for skipped components
 */
public record VariableDeclarationStatementAnnotation(List<NodeRef> assignments) {
}
