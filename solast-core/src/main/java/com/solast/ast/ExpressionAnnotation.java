package com.solast.ast;

/**
 * Analysis results shared by every expression.
 *
 * @param type the resolved type, or null if analysis did not determine one
 */
public record ExpressionAnnotation(
    ResolvedType type,
    boolean isConstant,
    boolean isPure,
    boolean isLValue,
    boolean lValueRequested
) {
    public static ExpressionAnnotation of(String typeName) {
        return new ExpressionAnnotation(ResolvedType.of(typeName), false, false, false, false);
    }

    public static ExpressionAnnotation unknown() {
        return new ExpressionAnnotation(null, false, false, false, false);
    }
}
