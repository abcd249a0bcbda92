package com.linlay.agentreplay.autoconfigure;

import com.linlay.agentreplay.service.SessionReplayService;
import com.linlay.agentreplay.transcript.ToolUseMerger;
import com.linlay.agentreplay.transcript.question.AnswerMessageParser;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "agent.replay")
public record ReplayProperties(
        String questionToolName,
        String answersMarker,
        String unknownToolName,
        String emptyResultPlaceholder
) {

    @ConstructorBinding
    public ReplayProperties {
        if (!StringUtils.hasText(questionToolName)) {
            questionToolName = SessionReplayService.DEFAULT_QUESTION_TOOL_NAME;
        }
        if (!StringUtils.hasText(answersMarker)) {
            answersMarker = AnswerMessageParser.DEFAULT_MARKER;
        }
        if (!StringUtils.hasText(unknownToolName)) {
            unknownToolName = ToolUseMerger.DEFAULT_UNKNOWN_TOOL_NAME;
        }
        if (emptyResultPlaceholder == null) {
            emptyResultPlaceholder = ToolUseMerger.DEFAULT_EMPTY_RESULT;
        }
    }

    public ReplayProperties() {
        this(null, null, null, null);
    }
}
