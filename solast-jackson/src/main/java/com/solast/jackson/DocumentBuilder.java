package com.solast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solast.ast.Node;
import com.solast.json.SchemaVariant;
import com.solast.json.SourceLocationEncoder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the document of one node from its identity, location, kind tag and attributes.
 *
 * <p>Attributes are applied in order; a later attribute with the same name replaces the
 * earlier value but keeps its position. Embedded children are already converted when they
 * get here, so building is a pure function of its arguments.</p>
 */
final class DocumentBuilder {

    private final SourceLocationEncoder locationEncoder;
    private final SchemaVariant schemaVariant;
    private final JsonNodeFactory nodeFactory;

    DocumentBuilder(SourceLocationEncoder locationEncoder, SchemaVariant schemaVariant, JsonNodeFactory nodeFactory) {
        this.locationEncoder = locationEncoder;
        this.schemaVariant = schemaVariant;
        this.nodeFactory = nodeFactory;
    }

    ObjectNode build(Node node, String nodeType, List<Attribute> attributes) {
        Map<String, Attribute> merged = new LinkedHashMap<>();
        for (Attribute attribute : attributes) {
            merged.put(attribute.name(), attribute);
        }

        ObjectNode document = nodeFactory.objectNode();
        document.put("id", node.id());
        document.put("src", locationEncoder.encode(node.location()));
        if (schemaVariant == SchemaVariant.LEGACY) {
            document.put("name", nodeType);
            ObjectNode plain = nodeFactory.objectNode();
            ArrayNode children = nodeFactory.arrayNode();
            for (Attribute attribute : merged.values()) {
                if (attribute.embedded()) {
                    addChildren(children, attribute.value());
                } else {
                    plain.set(attribute.name(), attribute.value());
                }
            }
            document.set("attributes", plain);
            document.set("children", children);
        } else {
            document.put("nodeType", nodeType);
            for (Attribute attribute : merged.values()) {
                document.set(attribute.name(), attribute.value());
            }
        }
        return document;
    }

    private static void addChildren(ArrayNode children, JsonNode value) {
        if (value.isArray()) {
            for (JsonNode element : value) {
                addChildren(children, element);
            }
        } else if (value.isObject()) {
            children.add(value);
        }
    }

    /**
     * One named attribute of a document.
     *
     * @param embedded whether the value holds child documents rather than scalars or ids
     */
    record Attribute(String name, JsonNode value, boolean embedded) {

        static Attribute of(String name, JsonNode value) {
            return new Attribute(name, value, false);
        }

        static Attribute of(String name, String value) {
            return of(name, value == null ? JsonNodeFactory.instance.nullNode() : JsonNodeFactory.instance.textNode(value));
        }

        static Attribute of(String name, boolean value) {
            return of(name, JsonNodeFactory.instance.booleanNode(value));
        }

        static Attribute child(String name, JsonNode documents) {
            return new Attribute(name, documents, true);
        }
    }
}
