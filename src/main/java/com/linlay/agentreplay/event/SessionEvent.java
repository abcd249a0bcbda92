package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One immutable entry of a session event log.
 * <p>
 * {@code sequence} is unique and increasing only within the event's own session; {@code timestamp}
 * is kept as the raw ISO-8601 string and parsed lazily where ordering needs it.
 */
public record SessionEvent(
        String id,
        String parentId,
        String sessionId,
        String workspaceId,
        String type,
        String timestamp,
        long sequence,
        JsonNode payload
) {

    public SessionEvent {
        requireNonBlank(id, "id");
        requireNonBlank(type, "type");
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }
}
