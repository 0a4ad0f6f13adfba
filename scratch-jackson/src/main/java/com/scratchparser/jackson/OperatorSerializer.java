package com.scratchparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.scratchparser.ast.Operator;

import java.io.IOException;

/**
 * Writes operator enums by their canonical symbol ({@code "+"}, {@code "&&"}, ...) rather
 * than by constant name.
 */
public class OperatorSerializer extends JsonSerializer<Operator> {
    @Override
    public void serialize(Operator value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(value.symbol());
    }

    @Override
    public Class<Operator> handledType() {
        return Operator.class;
    }
}
