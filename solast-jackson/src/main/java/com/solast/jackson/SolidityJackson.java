package com.solast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.solast.ast.Node;
import com.solast.json.AstJsonOptions;

import java.util.Collection;
import java.util.List;

/**
 * Factory for ObjectMapper instances that serialize syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SolidityJackson.createObjectMapper(options);
 * String json = mapper.writeValueAsString(sourceUnit);
 * </pre>
 */
public final class SolidityJackson {

    private SolidityJackson() {
        // Utility class
    }

    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(AstJsonOptions.defaults());
    }

    /**
     * Creates a mapper for trees without cross-file references.
     */
    public static ObjectMapper createObjectMapper(AstJsonOptions options) {
        return createObjectMapper(options, List.of());
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Serializes Node values through {@link SolidityAstModule}
     * - Writes null attributes, which are part of every kind's fixed key set
     * - Keeps attribute order as built instead of sorting keys
     * - Resolves references into the {@code imports} trees, which it never serializes itself
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper(AstJsonOptions options, Collection<? extends Node> imports) {
        ObjectMapper mapper = new ObjectMapper();

        // Absent children and references are written as explicit nulls
        mapper.configure(JsonNodeFeature.WRITE_NULL_PROPERTIES, true);

        // Attribute order is part of the output contract
        mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, false);

        mapper.registerModule(new SolidityAstModule(options, imports));

        return mapper;
    }
}
