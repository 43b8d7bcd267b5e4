package com.solast.ast;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from node id to node, built once over one or more trees.
 */
public final class NodeIndex {

    private final Map<Long, Node> nodesById;

    private NodeIndex(Map<Long, Node> nodesById) {
        this.nodesById = nodesById;
    }

    public static NodeIndex of(Node... roots) {
        return of(Arrays.asList(roots));
    }

    /**
     * Indexes every node reachable from the given roots.
     *
     * @throws IllegalArgumentException if two distinct nodes share an id
     */
    public static NodeIndex of(Collection<? extends Node> roots) {
        Map<Long, Node> nodesById = new HashMap<>();
        for (Node root : roots) {
            Nodes.walk(root, node -> {
                Node previous = nodesById.putIfAbsent(node.id(), node);
                if (previous != null && previous != node) {
                    throw new IllegalArgumentException(
                        "Duplicate node id " + node.id() + ": " + previous.nodeType() + " and " + node.nodeType());
                }
            });
        }
        return new NodeIndex(nodesById);
    }

    public boolean contains(long id) {
        return nodesById.containsKey(id);
    }

    public boolean contains(NodeRef ref) {
        return ref != null && contains(ref.id());
    }

    public Optional<Node> find(NodeRef ref) {
        return ref == null ? Optional.empty() : Optional.ofNullable(nodesById.get(ref.id()));
    }

    public int size() {
        return nodesById.size();
    }
}
