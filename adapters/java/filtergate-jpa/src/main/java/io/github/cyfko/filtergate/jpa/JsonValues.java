package io.github.cyfko.filtergate.jpa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.filtergate.core.exception.FilterValidationException;

/**
 * Jackson helpers for values bound as JSON text and for plans returned as JSON.
 *
 * @since 1.0.0
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {
    }

    /**
     * Encodes a filter value as JSON text.
     *
     * @throws FilterValidationException if the value cannot be serialized
     */
    public static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FilterValidationException("Value cannot be encoded as JSON: " + value, e);
        }
    }

    /**
     * Parses JSON text returned by the database.
     *
     * @throws IllegalStateException if the text is not JSON
     */
    public static JsonNode read(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Database returned malformed JSON", e);
        }
    }
}
