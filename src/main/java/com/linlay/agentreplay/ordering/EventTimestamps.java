package com.linlay.agentreplay.ordering;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class EventTimestamps {

    private EventTimestamps() {
    }

    /**
     * Parses an ISO-8601 instant such as {@code 2025-01-01T10:00:00Z},
     * {@code 2025-01-01T10:00:00.123Z} or {@code 2025-01-01T12:00:00+02:00}.
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(raw.trim()).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
