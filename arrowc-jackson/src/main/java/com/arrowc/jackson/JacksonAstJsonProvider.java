package com.arrowc.jackson;

import com.arrowc.Token;
import com.arrowc.ast.Node;
import com.arrowc.ast.Program;
import com.arrowc.json.*;
import com.arrowc.target.TargetNode;
import com.arrowc.target.TargetProgram;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.List;

/**
 * {@link AstJsonProvider} backed by a Jackson {@link ObjectMapper} configured by
 * {@link ArrowcJackson#createObjectMapper()}. Registered for {@code ServiceLoader} lookup.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(ArrowcJackson.createObjectMapper());
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
        private final ObjectWriter compact;
        private final ObjectWriter pretty;

        JacksonSerializer(ObjectMapper mapper) {
            this.compact = mapper.writer();
            this.pretty = mapper.writerWithDefaultPrettyPrinter();
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            return write(compact.forType(Node.class), node, "source node");
        }

        @Override
        public String serialize(TargetNode node) throws AstJsonException {
            return write(compact.forType(TargetNode.class), node, "target node");
        }

        @Override
        public String serializeTokens(List<Token> tokens) throws AstJsonException {
            return write(compact, tokens, "tokens");
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            return write(pretty.forType(Node.class), node, "source node");
        }

        @Override
        public String serializePretty(TargetNode node) throws AstJsonException {
            return write(pretty.forType(TargetNode.class), node, "target node");
        }

        @Override
        public String serializeTokensPretty(List<Token> tokens) throws AstJsonException {
            return write(pretty, tokens, "tokens");
        }

        private static String write(ObjectWriter writer, Object value, String what) {
            try {
                return writer.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + what, e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            return read(json, Program.class);
        }

        @Override
        public TargetProgram deserializeTargetProgram(String json) throws AstJsonException {
            return read(json, TargetProgram.class);
        }

        private <T> T read(String json, Class<T> type) {
            if (json == null || json.isBlank()) {
                throw new AstJsonException("No JSON to read as " + type.getSimpleName());
            }
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to read " + type.getSimpleName(), e);
            }
        }
    }
}
