package com.solast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.solast.ast.NodeIndex;
import com.solast.ast.NodeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns weak references into the referenced node's id, never into its document.
 *
 * <p>A reference whose target is not part of the index is written as null, so the
 * output never carries an id that no document in it (or in an indexed import) has.</p>
 */
final class ReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    private final NodeIndex index;
    private final JsonNodeFactory nodeFactory;

    ReferenceResolver(NodeIndex index, JsonNodeFactory nodeFactory) {
        this.index = index;
        this.nodeFactory = nodeFactory;
    }

    JsonNode idOrNull(NodeRef ref) {
        if (ref == null) {
            return nodeFactory.nullNode();
        }
        if (!index.contains(ref)) {
            logger.warn("Dropping reference to node {}: not part of the converted trees", ref.id());
            return nodeFactory.nullNode();
        }
        return nodeFactory.numberNode(ref.id());
    }

    ArrayNode idList(List<NodeRef> refs) {
        ArrayNode ids = nodeFactory.arrayNode();
        for (NodeRef ref : refs) {
            ids.add(idOrNull(ref));
        }
        return ids;
    }
}
