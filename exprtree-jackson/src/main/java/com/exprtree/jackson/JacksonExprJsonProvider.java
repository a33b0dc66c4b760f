package com.exprtree.jackson;

import com.exprtree.ast.Expr;
import com.exprtree.json.ExprJsonException;
import com.exprtree.json.ExprJsonProvider;
import com.exprtree.json.ExprJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of ExprJsonProvider.
 */
public class JacksonExprJsonProvider implements ExprJsonProvider {

    private final ObjectMapper mapper;
    private final ExprJsonSerializer serializer;

    public JacksonExprJsonProvider() {
        this(ExprTreeJackson.createObjectMapper());
    }

    public JacksonExprJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public ExprJsonSerializer getSerializer() {
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

    private static class JacksonSerializer implements ExprJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Expr expr) throws ExprJsonException {
            try {
                return mapper.writeValueAsString(expr);
            } catch (JsonProcessingException e) {
                throw new ExprJsonException("Failed to serialize " + expr.kind().getKindName() + " expression", e);
            }
        }

        @Override
        public String serializePretty(Expr expr) throws ExprJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(expr);
            } catch (JsonProcessingException e) {
                throw new ExprJsonException("Failed to serialize " + expr.kind().getKindName() + " expression", e);
            }
        }
    }
}
