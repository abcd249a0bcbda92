package com.linlay.agentreplay.index;

/**
 * @param eventId   id of the {@code tool.call} event the details were read from
 * @param arguments serialized arguments, {@code null} when the call carried none
 */
public record ToolCallDetails(
        String eventId,
        String toolCallId,
        String name,
        String arguments,
        int turn
) {
}
