package com.solast.ast;

/**
 * Annotation of struct and enum definitions.
 */
public record TypeDeclarationAnnotation(String canonicalName) {
}
