package com.linlay.agentreplay.event;

import com.linlay.agentreplay.ordering.EventTimestamps;

import java.time.Instant;
import java.util.Objects;

/**
 * An envelope paired with its successfully decoded, typed payload.
 */
public record DecodedEvent(SessionEvent envelope, EventType type, EventPayload payload) {

    public DecodedEvent {
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    public String id() {
        return envelope.id();
    }

    public Instant timestamp() {
        return EventTimestamps.parse(envelope.timestamp()).orElse(null);
    }

    public boolean is(EventType candidate) {
        return type == candidate;
    }
}
