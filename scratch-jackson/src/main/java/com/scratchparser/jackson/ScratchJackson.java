package com.scratchparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ScratchJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * </pre>
 */
public final class ScratchJackson {

    private ScratchJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization.
     *
     * The returned mapper:
     * - Writes every node with a leading "type" property naming the node kind
     * - Writes absent optional children as explicit nulls
     * - Writes operators by their source symbol
     * - Accepts nodes without fields (ThisExpr, NullLit, ...)
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // null and [] are different states of a node and both must be written
        mapper.setSerializationInclusion(JsonInclude.Include.ALWAYS);

        // Field-less nodes still carry their type id
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }

    /**
     * Returns a writer producing the two-space indented layout of {@link AstPrettyPrinter}.
     */
    public static ObjectWriter prettyWriter(ObjectMapper mapper) {
        return mapper.writer(new AstPrettyPrinter());
    }
}
