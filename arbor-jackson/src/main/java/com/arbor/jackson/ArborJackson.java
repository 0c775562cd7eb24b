package com.arbor.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for trees.
 *
 * <pre>
 * ObjectMapper mapper = ArborJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program copy = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class ArborJackson {

    private ArborJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that leaves source spans out of the output.
     */
    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(false);
    }

    /**
     * Creates a new ObjectMapper for trees.
     *
     * The returned mapper:
     * - Writes the variant name of each node in a "type" property and uses it to read nodes back
     * - Leaves out parents, entities, annotations and end spans
     * - Writes each node's own span as "loc" when {@code includeLocations} is set
     * - Reads integral numbers as longs, matching how literals hold them
     *
     * @param includeLocations whether own spans are written
     * @return a new configured ObjectMapper
     */
    public static ObjectMapper createObjectMapper(boolean includeLocations) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Null optional children are left out unless a mixin in AstModule says otherwise
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.USE_LONG_FOR_INTS, true);

        // Nodes are built through their no-arg constructors and setters so parent links are wired
        mapper.setConstructorDetector(ConstructorDetector.DEFAULT.withRequireAnnotation(true));

        mapper.registerModule(new AstModule(includeLocations));

        return mapper;
    }
}
