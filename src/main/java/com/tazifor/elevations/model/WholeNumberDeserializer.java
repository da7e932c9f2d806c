package com.tazifor.elevations.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads a JSON integer into an {@link Integer}, refusing floats and strings
 * that Jackson would otherwise coerce (11.9 truncated to 11, "11" parsed).
 */
public class WholeNumberDeserializer extends StdDeserializer<Integer> {

    public WholeNumberDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p.currentToken(), p,
            "expected a whole number, got %s", p.getText());
    }
}
