package com.arrowc.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for token and tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ArrowcJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * TargetProgram target = mapper.readValue(json, TargetProgram.class);
 * </pre>
 */
public final class ArrowcJackson {

    private ArrowcJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for serialization/deserialization.
     *
     * The returned mapper:
     * - Handles both node hierarchies polymorphically via the "type" property
     * - Writes token types in lower case ("paren", "arrow", ...)
     * - Leaves out null values
     * - Ignores unknown properties (such as source offsets on generated nodes) when reading
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
