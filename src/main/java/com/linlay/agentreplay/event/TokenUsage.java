package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;

public record TokenUsage(
        long inputTokens,
        long outputTokens,
        long cacheReadTokens,
        long cacheCreationTokens
) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || cacheReadTokens < 0 || cacheCreationTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }

    /**
     * Reads a usage object written either with {@code inputTokens}-style keys or the short
     * {@code input}/{@code output} keys. Missing or negative counts read as zero.
     *
     * @return {@code null} when {@code usage} is not a JSON object
     */
    public static TokenUsage fromNode(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return null;
        }
        return new TokenUsage(
                nonNegative(JsonNodes.firstLong(usage, "inputTokens", "input")),
                nonNegative(JsonNodes.firstLong(usage, "outputTokens", "output")),
                nonNegative(JsonNodes.longValue(usage, "cacheReadTokens")),
                nonNegative(JsonNodes.longValue(usage, "cacheCreationTokens"))
        );
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                cacheReadTokens + other.cacheReadTokens,
                cacheCreationTokens + other.cacheCreationTokens
        );
    }

    /**
     * Context occupancy of the request that produced this usage. Input, cache-read and
     * cache-creation tokens are mutually exclusive, so their sum is the full prompt size.
     */
    public long contextWindowTokens() {
        return inputTokens + cacheReadTokens + cacheCreationTokens;
    }

    private static long nonNegative(Long value) {
        return value == null || value < 0 ? 0L : value;
    }
}
