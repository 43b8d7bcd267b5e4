package com.solast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.solast.ast.Node;
import com.solast.json.AstJsonOptions;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Jackson module that serializes syntax tree nodes as their JSON documents.
 *
 * <p>With this module registered, {@code mapper.writeValueAsString(sourceUnit)} produces the same
 * text as serializing {@link AstJsonConverter#toJson(Node)}.</p>
 */
public class SolidityAstModule extends SimpleModule {

    private final AstJsonConverter converter;

    public SolidityAstModule() {
        this(AstJsonOptions.defaults());
    }

    public SolidityAstModule(AstJsonOptions options) {
        this(options, List.of());
    }

    /**
     * @param imports roots of imported trees that serialized nodes may reference
     */
    public SolidityAstModule(AstJsonOptions options, Collection<? extends Node> imports) {
        super("SolidityAstModule", new Version(0, 1, 0, "SNAPSHOT", "com.solast", "solast-jackson"));
        this.converter = new AstJsonConverter(options);
        addSerializer(Node.class, new NodeSerializer(converter, List.copyOf(imports)));
    }

    public AstJsonConverter getConverter() {
        return converter;
    }

    private static class NodeSerializer extends StdSerializer<Node> {
        private final AstJsonConverter converter;
        private final List<Node> imports;

        NodeSerializer(AstJsonConverter converter, List<Node> imports) {
            super(Node.class);
            this.converter = converter;
            this.imports = imports;
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(converter.toJson(node, imports), gen);
        }
    }
}
