package com.solast.ast;

/**
 * A type determined by semantic analysis, reduced to its display string.
 */
public record ResolvedType(String displayName) {

    public static ResolvedType of(String displayName) {
        return new ResolvedType(displayName);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
