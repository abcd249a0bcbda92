package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient typed reads over payload nodes. A missing field and a field of the wrong JSON type
 * both read as {@code null}; callers decide whether that is fatal for the event.
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = field(node, field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return value.asText();
    }

    public static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Integer integer(JsonNode node, String field) {
        JsonNode value = field(node, field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            return null;
        }
        return value.intValue();
    }

    public static Integer firstInteger(JsonNode node, String... fields) {
        for (String field : fields) {
            Integer value = integer(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Long longValue(JsonNode node, String field) {
        JsonNode value = field(node, field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            return null;
        }
        return value.longValue();
    }

    public static Long firstLong(JsonNode node, String... fields) {
        for (String field : fields) {
            Long value = longValue(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Boolean bool(JsonNode node, String field) {
        JsonNode value = field(node, field);
        if (value == null || !value.isBoolean()) {
            return null;
        }
        return value.booleanValue();
    }

    public static boolean boolOrFalse(JsonNode node, String field) {
        return Boolean.TRUE.equals(bool(node, field));
    }

    public static List<String> stringList(JsonNode node, String field) {
        JsonNode value = field(node, field);
        if (value == null || !value.isArray()) {
            return null;
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (item != null && item.isTextual()) {
                items.add(item.asText());
            }
        }
        return List.copyOf(items);
    }

    public static JsonNode object(JsonNode node, String field) {
        JsonNode value = field(node, field);
        return value != null && value.isObject() ? value : null;
    }

    public static JsonNode array(JsonNode node, String field) {
        JsonNode value = field(node, field);
        return value != null && value.isArray() ? value : null;
    }

    public static JsonNode field(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value;
    }
}
