package com.exprtree.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for expression trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ExprTreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(expr);
 * </pre>
 */
public final class ExprTreeJackson {

    private ExprTreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for expression tree serialization.
     *
     * The returned mapper:
     * - Writes every node as an object led by its kind name and type
     * - Leaves out the arena header
     * - Writes source locations as offsets and declarations as table indexes
     * - Omits absent children
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Absent children are left out; kind and type are always written
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new ExprModule());

        return mapper;
    }
}
