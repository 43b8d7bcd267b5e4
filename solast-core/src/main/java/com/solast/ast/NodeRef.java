package com.solast.ast;

/**
 * Weak reference to another node by id. Carries no ownership.
 */
public record NodeRef(long id) {

    public static NodeRef to(Node node) {
        return new NodeRef(node.id());
    }
}
