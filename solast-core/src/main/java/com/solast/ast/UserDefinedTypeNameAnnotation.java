package com.solast.ast;

public record UserDefinedTypeNameAnnotation(NodeRef referencedDeclaration, NodeRef contractScope) {
}
