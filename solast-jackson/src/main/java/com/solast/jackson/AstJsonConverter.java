package com.solast.jackson;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solast.ast.Node;
import com.solast.ast.NodeIndex;
import com.solast.json.AstJsonOptions;
import com.solast.json.SourceLocationEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Converts a syntax tree into its JSON document.
 *
 * <p>Usage:</p>
 * <pre>
 * AstJsonConverter converter = new AstJsonConverter(AstJsonOptions.builder().sourceIndex("a.sol", 0).build());
 * ObjectNode document = converter.toJson(sourceUnit);
 * </pre>
 *
 * <p>The converter keeps only its configuration; all per-conversion state lives inside
 * {@link #toJson(Node, NodeIndex)}, so one instance may be shared between threads.</p>
 */
public final class AstJsonConverter {

    private static final Logger logger = LoggerFactory.getLogger(AstJsonConverter.class);

    private final AstJsonOptions options;
    private final SourceLocationEncoder locationEncoder;
    private final JsonNodeFactory nodeFactory;

    public AstJsonConverter() {
        this(AstJsonOptions.defaults());
    }

    public AstJsonConverter(AstJsonOptions options) {
        this.options = options;
        this.locationEncoder = new SourceLocationEncoder(options.sourceIndices());
        this.nodeFactory = JsonNodeFactory.instance;
    }

    public AstJsonOptions getOptions() {
        return options;
    }

    /**
     * Converts the tree rooted at {@code root}. References may only point into that tree.
     */
    public ObjectNode toJson(Node root) {
        return toJson(root, NodeIndex.of(root));
    }

    /**
     * Converts the tree rooted at {@code root}. References may point into that tree or into any of
     * the {@code imports} trees, which are indexed but not converted.
     */
    public ObjectNode toJson(Node root, Collection<? extends Node> imports) {
        List<Node> roots = new ArrayList<>(imports.size() + 1);
        roots.add(root);
        roots.addAll(imports);
        return toJson(root, NodeIndex.of(roots));
    }

    /**
     * Converts the tree rooted at {@code root}, resolving references against {@code index}.
     * Pass an index that also covers imported source units to keep references into them.
     *
     * @throws com.solast.json.InternalCompilerError if an analysis result has no label in the schema
     */
    public ObjectNode toJson(Node root, NodeIndex index) {
        logger.debug("Converting {} {} ({} indexed nodes, {} schema)",
            root.nodeType(), root.id(), index.size(), options.schemaVariant());
        DocumentBuilder builder = new DocumentBuilder(locationEncoder, options.schemaVariant(), nodeFactory);
        ReferenceResolver references = new ReferenceResolver(index, nodeFactory);
        ObjectNode document = root.accept(new SchemaVisitor(builder, references, nodeFactory), ConversionContext.ROOT);
        logger.debug("Converted {} {}", root.nodeType(), root.id());
        return document;
    }
}
