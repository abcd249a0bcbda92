package com.linlay.agentreplay.index;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup tables built in the first pass over an ordered event sequence.
 * <p>
 * Tool calls and results whose own event was tombstoned are not present.
 */
public record CorrelationIndex(
        Map<String, ToolCallDetails> toolCalls,
        Map<String, ToolResultDetails> toolResults,
        Set<String> deletedEventIds,
        String latestReasoningLevel
) {

    public static final CorrelationIndex EMPTY = new CorrelationIndex(Map.of(), Map.of(), Set.of(), null);

    public CorrelationIndex {
        toolCalls = toolCalls == null ? Map.of() : Map.copyOf(toolCalls);
        toolResults = toolResults == null ? Map.of() : Map.copyOf(toolResults);
        deletedEventIds = deletedEventIds == null ? Set.of() : Set.copyOf(deletedEventIds);
    }

    public Optional<ToolCallDetails> toolCall(String toolCallId) {
        return toolCallId == null ? Optional.empty() : Optional.ofNullable(toolCalls.get(toolCallId));
    }

    public Optional<ToolResultDetails> toolResult(String toolCallId) {
        return toolCallId == null ? Optional.empty() : Optional.ofNullable(toolResults.get(toolCallId));
    }

    public boolean isDeleted(String eventId) {
        return eventId != null && deletedEventIds.contains(eventId);
    }
}
