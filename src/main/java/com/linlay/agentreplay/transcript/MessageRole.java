package com.linlay.agentreplay.transcript;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    /**
     * Standalone tool output, only produced by the live stream where results arrive separately.
     */
    TOOL_RESULT
}
