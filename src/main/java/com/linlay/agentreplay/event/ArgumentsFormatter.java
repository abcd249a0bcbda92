package com.linlay.agentreplay.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Objects;

/**
 * Serializes structured tool input into a stable JSON string: object keys are sorted at every
 * depth so that the same input always yields the same text.
 */
public class ArgumentsFormatter {

    public static final String EMPTY_ARGUMENTS = "{}";

    private final ObjectMapper canonicalMapper;

    public ArgumentsFormatter(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return canonical JSON of {@code input}, or {@code null} when the input is absent or is not a
     * JSON object
     */
    public String format(JsonNode input) {
        if (input == null || !input.isObject()) {
            return null;
        }
        try {
            // JsonNode keeps insertion order; going through Map lets ORDER_MAP_ENTRIES_BY_KEYS apply
            Object plain = canonicalMapper.convertValue(input, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            return null;
        }
    }

    public String formatOrEmpty(JsonNode input) {
        String formatted = format(input);
        return formatted == null ? EMPTY_ARGUMENTS : formatted;
    }
}
