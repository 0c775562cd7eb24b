package com.arbor.jackson;

import com.arbor.ast.Node;
import com.arbor.ast.Program;
import com.arbor.json.AstJsonDeserializer;
import com.arbor.json.AstJsonException;
import com.arbor.json.AstJsonProvider;
import com.arbor.json.AstJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    /**
     * Used by {@link java.util.ServiceLoader}. Spans are not written.
     */
    public JacksonAstJsonProvider() {
        this(ArborJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + describe(node), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + describe(node), e);
            }
        }

        private static String describe(Node node) {
            return node == null ? "null node" : node.getNodeType().getTypeName();
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            return deserialize(json, Program.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            if (json == null) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName() + ": no input");
            }
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
