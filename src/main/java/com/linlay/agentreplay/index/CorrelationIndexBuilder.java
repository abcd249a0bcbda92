package com.linlay.agentreplay.index;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link CorrelationIndex} in one linear scan.
 * <p>
 * A tombstone may appear after the events it hides, so entries are collected first and filtered
 * against the complete deleted-id set before the index is returned.
 */
public class CorrelationIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIndexBuilder.class);

    public CorrelationIndex build(List<DecodedEvent> orderedEvents) {
        Objects.requireNonNull(orderedEvents, "orderedEvents must not be null");

        List<ToolCallDetails> callEntries = new ArrayList<>();
        List<ToolResultDetails> resultEntries = new ArrayList<>();
        Set<String> deleted = new HashSet<>();
        List<ReasoningChange> reasoningChanges = new ArrayList<>();

        for (DecodedEvent event : orderedEvents) {
            EventPayload payload = event.payload();
            if (payload instanceof EventPayload.ToolCall call) {
                callEntries.add(new ToolCallDetails(
                        event.id(),
                        call.toolCallId(),
                        call.name(),
                        call.arguments(),
                        call.turn()
                ));
            } else if (payload instanceof EventPayload.ToolResult result) {
                resultEntries.add(new ToolResultDetails(
                        event.id(),
                        result.toolCallId(),
                        result.content(),
                        result.error(),
                        result.durationMs(),
                        result.truncated(),
                        result.affectedFiles(),
                        result.name(),
                        result.arguments()
                ));
            } else if (payload instanceof EventPayload.MessageDeleted deletion) {
                deleted.add(deletion.targetEventId());
            } else if (payload instanceof EventPayload.ReasoningLevel level) {
                reasoningChanges.add(new ReasoningChange(event.id(), level.newLevel()));
            }
        }

        // later entries for the same tool call id overwrite earlier ones
        Map<String, ToolCallDetails> calls = new HashMap<>();
        for (ToolCallDetails details : callEntries) {
            if (!deleted.contains(details.eventId())) {
                calls.put(details.toolCallId(), details);
            }
        }
        Map<String, ToolResultDetails> results = new HashMap<>();
        for (ToolResultDetails details : resultEntries) {
            if (!deleted.contains(details.eventId())) {
                results.put(details.toolCallId(), details);
            }
        }

        String latestReasoningLevel = null;
        for (ReasoningChange change : reasoningChanges) {
            if (!deleted.contains(change.eventId())) {
                latestReasoningLevel = change.level();
            }
        }

        log.debug("Correlation index built: calls={}, results={}, deleted={}", calls.size(), results.size(), deleted.size());
        return new CorrelationIndex(calls, results, deleted, latestReasoningLevel);
    }

    private record ReasoningChange(String eventId, String level) {
    }
}
