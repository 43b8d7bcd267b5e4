package com.solast.ast;

import java.util.List;
import java.util.Map;

/**
 * @param path absolute path of the source file
 * @param exportedSymbols symbol name to the declarations (overloads) it denotes; iteration order is preserved
 */
public record SourceUnitAnnotation(String path, Map<String, List<NodeRef>> exportedSymbols) {
}
