package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps stored event logs into {@link SessionEvent} envelopes.
 * <p>
 * Accepts a JSON array of events, a history response of the form {@code {"events": [...]}}, or
 * JSON Lines with one event per line. Remote history entries and locally cached entries differ
 * only in a few field names, which are reconciled here.
 */
public class SessionEventReader {

    private static final Logger log = LoggerFactory.getLogger(SessionEventReader.class);

    private final ObjectMapper objectMapper;

    public SessionEventReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public List<SessionEvent> read(String json) {
        if (!StringUtils.hasText(json)) {
            return List.of();
        }
        String trimmed = json.trim();
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            JsonNode root = parseDocument(trimmed);
            if (root != null && root.isArray()) {
                return readArray(root);
            }
            if (root != null && root.isObject()) {
                JsonNode events = root.get("events");
                if (events != null && events.isArray()) {
                    return readArray(events);
                }
                SessionEvent single = toEvent(root, 0);
                return single == null ? List.of() : List.of(single);
            }
        }
        return readLines(trimmed);
    }

    public List<SessionEvent> readArray(JsonNode events) {
        if (events == null || !events.isArray()) {
            return List.of();
        }
        List<SessionEvent> result = new ArrayList<>(events.size());
        int index = 0;
        for (JsonNode node : events) {
            SessionEvent event = toEvent(node, index++);
            if (event != null) {
                result.add(event);
            }
        }
        return result;
    }

    private List<SessionEvent> readLines(String text) {
        List<SessionEvent> result = new ArrayList<>();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!StringUtils.hasText(line)) {
                continue;
            }
            JsonNode node = parseLine(line);
            if (node == null) {
                log.warn("Skip unparseable event line {}", i + 1);
                continue;
            }
            SessionEvent event = toEvent(node, i);
            if (event != null) {
                result.add(event);
            }
        }
        return result;
    }

    private SessionEvent toEvent(JsonNode node, int position) {
        if (node == null || !node.isObject()) {
            log.warn("Skip non-object event entry at position {}", position);
            return null;
        }
        String id = JsonNodes.firstText(node, "id", "eventId");
        String type = JsonNodes.firstText(node, "type", "eventType");
        if (!StringUtils.hasText(id) || !StringUtils.hasText(type)) {
            log.warn("Skip event entry without id or type at position {}", position);
            return null;
        }
        Long sequence = JsonNodes.firstLong(node, "sequence", "seq");
        JsonNode payload = JsonNodes.field(node, "payload");
        if (payload != null && payload.isTextual()) {
            // cached rows keep the payload as a serialized string
            payload = parseLine(payload.asText());
        }
        return new SessionEvent(
                id,
                JsonNodes.firstText(node, "parentId", "parentEventId"),
                JsonNodes.text(node, "sessionId"),
                JsonNodes.text(node, "workspaceId"),
                type,
                JsonNodes.firstText(node, "timestamp", "createdAt"),
                sequence == null ? position : sequence,
                payload != null && payload.isObject() ? payload : null
        );
    }

    private JsonNode parseDocument(String text) {
        try {
            // JSON Lines input must not be mistaken for its first line
            return objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(text);
        } catch (Exception ex) {
            return null;
        }
    }

    private JsonNode parseLine(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (Exception ex) {
            return null;
        }
    }
}
