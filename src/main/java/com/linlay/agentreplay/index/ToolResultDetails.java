package com.linlay.agentreplay.index;

import java.util.List;

public record ToolResultDetails(
        String eventId,
        String toolCallId,
        String content,
        boolean error,
        Long durationMs,
        Boolean truncated,
        List<String> affectedFiles,
        String name,
        String arguments
) {

    public ToolResultDetails {
        content = content == null ? "" : content;
        affectedFiles = affectedFiles == null ? List.of() : List.copyOf(affectedFiles);
    }
}
