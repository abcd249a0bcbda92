package com.linlay.agentreplay.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * An event from the live update channel. It has no envelope: in-flight turns have no event id or
 * sequence yet.
 */
public record LiveEvent(String type, JsonNode data) {

    public LiveEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }
}
