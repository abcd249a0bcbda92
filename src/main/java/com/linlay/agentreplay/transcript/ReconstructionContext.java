package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.index.CorrelationIndex;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call view of the ordered event sequence shared by the transcript components.
 */
record ReconstructionContext(List<DecodedEvent> orderedEvents, Map<String, Integer> positions, CorrelationIndex index) {

    static ReconstructionContext of(List<DecodedEvent> orderedEvents, CorrelationIndex index) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < orderedEvents.size(); i++) {
            // first occurrence wins for duplicated ids
            positions.putIfAbsent(orderedEvents.get(i).id(), i);
        }
        return new ReconstructionContext(orderedEvents, positions, index);
    }

    int positionOf(String eventId) {
        Integer position = eventId == null ? null : positions.get(eventId);
        return position == null ? -1 : position;
    }
}
