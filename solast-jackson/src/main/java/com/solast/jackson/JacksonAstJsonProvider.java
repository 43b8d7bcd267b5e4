package com.solast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solast.ast.Node;
import com.solast.json.AstJsonException;
import com.solast.json.AstJsonOptions;
import com.solast.json.AstJsonProvider;
import com.solast.json.AstJsonSerializer;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final AstJsonSerializer defaultSerializer;

    public JacksonAstJsonProvider() {
        this.defaultSerializer = new JacksonSerializer(AstJsonOptions.defaults());
    }

    @Override
    public AstJsonSerializer getSerializer(AstJsonOptions options) {
        if (options == AstJsonOptions.defaults()) {
            return defaultSerializer;
        }
        return new JacksonSerializer(options);
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final AstJsonConverter converter;
        private final ObjectMapper mapper;

        JacksonSerializer(AstJsonOptions options) {
            this.converter = new AstJsonConverter(options);
            this.mapper = SolidityJackson.createObjectMapper(options);
        }

        // Conversion runs outside Jackson so that InternalCompilerError reaches the caller unwrapped

        @Override
        public String serialize(Node root, Collection<? extends Node> imports) throws AstJsonException {
            ObjectNode document = converter.toJson(root, imports);
            try {
                return mapper.writeValueAsString(document);
            } catch (IOException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializePretty(Node root, Collection<? extends Node> imports) throws AstJsonException {
            ObjectNode document = converter.toJson(root, imports);
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            } catch (IOException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public void write(Node root, Collection<? extends Node> imports, Writer out) throws AstJsonException {
            ObjectNode document = converter.toJson(root, imports);
            try {
                mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, document);
            } catch (IOException e) {
                throw new AstJsonException("Failed to write AST node", e);
            }
        }
    }
}
