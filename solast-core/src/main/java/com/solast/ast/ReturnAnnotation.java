package com.solast.ast;

/**
 * @param functionReturnParameters the return parameter list of the enclosing function
 */
public record ReturnAnnotation(NodeRef functionReturnParameters) {
}
