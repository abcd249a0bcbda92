package com.linlay.agentreplay.ordering;

import com.linlay.agentreplay.event.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decides the authoritative order of an event batch.
 * <p>
 * A batch read from one session is sorted by sequence, ties broken by timestamp. A batch stitched
 * from an ancestor chain spans several sessions whose sequences restart at each fork point, so the
 * caller marks it presorted and its order is kept as given.
 */
public final class EventOrdering {

    private static final Logger log = LoggerFactory.getLogger(EventOrdering.class);

    private static final Comparator<SessionEvent> BY_SEQUENCE_THEN_TIMESTAMP = Comparator
            .comparingLong(SessionEvent::sequence)
            .thenComparing(
                    event -> EventTimestamps.parse(event.timestamp()).orElse(null),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder())
            );

    private EventOrdering() {
    }

    public static List<SessionEvent> order(List<SessionEvent> events, boolean presorted) {
        Objects.requireNonNull(events, "events must not be null");
        List<SessionEvent> ordered = new ArrayList<>(events.size());
        for (SessionEvent event : events) {
            if (event != null) {
                ordered.add(event);
            }
        }
        if (!presorted) {
            // List.sort is stable, so fully tied events keep their input order
            ordered.sort(BY_SEQUENCE_THEN_TIMESTAMP);
        }
        return List.copyOf(ordered);
    }

    /**
     * Concatenates ancestor-chain segments, root session first, without any global re-sort.
     *
     * @param segments     one event batch per session, ordered from the root to the fork tip
     * @param sortSegments sort each segment on its own before stitching
     */
    public static List<SessionEvent> stitchAncestry(List<List<SessionEvent>> segments, boolean sortSegments) {
        Objects.requireNonNull(segments, "segments must not be null");
        List<SessionEvent> stitched = new ArrayList<>();
        for (List<SessionEvent> segment : segments) {
            if (segment == null) {
                continue;
            }
            stitched.addAll(order(segment, !sortSegments));
        }
        log.debug("Stitched {} ancestry segments into {} events", segments.size(), stitched.size());
        return List.copyOf(stitched);
    }

    public static List<SessionEvent> stitchAncestry(List<List<SessionEvent>> segments) {
        return stitchAncestry(segments, false);
    }
}
