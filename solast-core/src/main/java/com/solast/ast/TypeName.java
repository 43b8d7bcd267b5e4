package com.solast.ast;

/**
 * Common supertype of all type names. Sealed, so only the concrete kinds exist at runtime.
 */
public sealed interface TypeName extends Node permits
    ElementaryTypeName,
    UserDefinedTypeName,
    FunctionTypeName,
    Mapping,
    ArrayTypeName {
}
