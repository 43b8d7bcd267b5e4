package com.solast.json;

import com.solast.ast.Node;

import java.io.Writer;
import java.util.Collection;
import java.util.List;

/**
 * Serializes a syntax tree into its JSON document.
 *
 * <p>References are written as ids only when their target is in the serialized tree or in one
 * of the {@code imports} trees; any other reference is written as null. Pass the source units
 * of every imported file to keep cross-file references.</p>
 */
public interface AstJsonSerializer {

    /**
     * Serializes the tree rooted at the given node to a JSON string.
     *
     * @param root the root node, usually a SourceUnit
     * @return the JSON representation of the tree
     * @throws AstJsonException if conversion or serialization fails
     */
    default String serialize(Node root) throws AstJsonException {
        return serialize(root, List.of());
    }

    /**
     * Serializes the tree rooted at the given node, resolving references into the imported trees.
     *
     * @param root the root node, usually a SourceUnit
     * @param imports roots of other trees that references may point into; they are not serialized
     * @return the JSON representation of the tree
     * @throws AstJsonException if conversion or serialization fails
     */
    String serialize(Node root, Collection<? extends Node> imports) throws AstJsonException;

    /**
     * Serializes the tree rooted at the given node to a pretty-printed JSON string.
     *
     * @param root the root node
     * @return the pretty-printed JSON representation of the tree
     * @throws AstJsonException if conversion or serialization fails
     */
    default String serializePretty(Node root) throws AstJsonException {
        return serializePretty(root, List.of());
    }

    String serializePretty(Node root, Collection<? extends Node> imports) throws AstJsonException;

    /**
     * Writes the JSON document of the tree to the given writer. The writer is not closed.
     *
     * @throws AstJsonException if conversion fails or the writer cannot be written to
     */
    default void write(Node root, Writer out) throws AstJsonException {
        write(root, List.of(), out);
    }

    void write(Node root, Collection<? extends Node> imports, Writer out) throws AstJsonException;
}
