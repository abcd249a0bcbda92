package com.linlay.agentreplay.stream;

import com.linlay.agentreplay.event.TokenUsage;
import com.linlay.agentreplay.transcript.ToolStatus;

/**
 * Incremental UI state carried by live events that do not produce transcript messages.
 */
public sealed interface LiveStateUpdate permits
        LiveStateUpdate.TextDelta,
        LiveStateUpdate.ThinkingDelta,
        LiveStateUpdate.TurnStart,
        LiveStateUpdate.TurnEnd,
        LiveStateUpdate.Complete,
        LiveStateUpdate.ToolStatusUpdate {

    /**
     * @param accumulated full text so far when the producer sends it
     */
    record TextDelta(String delta, String accumulated) implements LiveStateUpdate {
    }

    record ThinkingDelta(String delta) implements LiveStateUpdate {
    }

    record TurnStart(int turn) implements LiveStateUpdate {
    }

    record TurnEnd(int turn, TokenUsage tokenUsage, String stopReason, Long durationMs) implements LiveStateUpdate {
    }

    record Complete(int turns, TokenUsage tokenUsage, boolean success, String error) implements LiveStateUpdate {
    }

    record ToolStatusUpdate(String toolCallId, ToolStatus status, String result, Long durationMs) implements LiveStateUpdate {
    }
}
