package com.linlay.agentreplay.transcript;

import java.time.Instant;
import java.util.Objects;

/**
 * One display-ready transcript entry.
 *
 * @param id         deterministic id, the originating event id for the first message of an
 *                   event and {@code <eventId>#<n>} for the following ones
 * @param timestamp  event time, {@code null} when the event carried no parseable timestamp
 * @param eventId    originating event, used to re-associate later tombstones
 * @param turnNumber agent turn, {@code null} for events outside a turn
 * @param metadata   turn aggregates, {@code null} on all but the first message of a turn
 */
public record TranscriptMessage(
        String id,
        MessageRole role,
        MessageContent content,
        Instant timestamp,
        String eventId,
        Integer turnNumber,
        TurnMetadata metadata
) {

    public TranscriptMessage {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
