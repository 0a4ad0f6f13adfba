package com.scratchparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.scratchparser.ast.Node;
import com.scratchparser.json.AstJsonException;
import com.scratchparser.json.AstJsonProvider;
import com.scratchparser.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = ScratchJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
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
        private final ObjectWriter prettyWriter;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
            this.prettyWriter = ScratchJackson.prettyWriter(mapper);
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return prettyWriter.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }
}
