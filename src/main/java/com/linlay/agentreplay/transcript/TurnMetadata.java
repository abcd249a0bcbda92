package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.TokenUsage;

/**
 * Aggregate data of one generative turn. Attached only to the first message a turn produces.
 */
public record TurnMetadata(
        TokenUsage tokenUsage,
        String model,
        Long latencyMs,
        Boolean hasThinking,
        String stopReason
) {
}
