package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.transcript.question.QuestionAnswer;
import com.linlay.agentreplay.transcript.question.QuestionSet;
import com.linlay.agentreplay.transcript.question.QuestionStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public sealed interface MessageContent permits
        MessageContent.Text,
        MessageContent.Thinking,
        MessageContent.ToolUse,
        MessageContent.ToolResult,
        MessageContent.Question,
        MessageContent.AnsweredQuestions,
        MessageContent.Error,
        MessageContent.Interrupted,
        MessageContent.ModelChange,
        MessageContent.ReasoningLevelChange,
        MessageContent.ContextCleared,
        MessageContent.CompactionBoundary,
        MessageContent.SkillRemoved {

    record Text(String text) implements MessageContent {
        public Text {
            text = text == null ? "" : text;
        }
    }

    record Thinking(String text) implements MessageContent {
    }

    /**
     * A tool invocation merged from its content block, call event and result event.
     *
     * @param result result content, {@code null} while the tool is still running
     */
    record ToolUse(
            String toolCallId,
            String toolName,
            String arguments,
            ToolStatus status,
            String result,
            Long durationMs,
            int turn
    ) implements MessageContent {
    }

    record ToolResult(
            String toolCallId,
            String toolName,
            String content,
            boolean error,
            Long durationMs
    ) implements MessageContent {
    }

    /**
     * @param answers parsed answers keyed by question id in the order the answer message lists
     *                them, empty unless answered
     */
    record Question(
            String toolCallId,
            QuestionSet questionSet,
            Map<String, QuestionAnswer> answers,
            QuestionStatus status
    ) implements MessageContent {
        public Question {
            answers = answers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
        }
    }

    record AnsweredQuestions(int questionCount) implements MessageContent {
    }

    record Error(String message) implements MessageContent {
    }

    record Interrupted() implements MessageContent {
    }

    record ModelChange(String from, String to) implements MessageContent {
    }

    record ReasoningLevelChange(String from, String to) implements MessageContent {
    }

    record ContextCleared(long tokensBefore, long tokensAfter) implements MessageContent {
    }

    record CompactionBoundary(long originalTokens, long compactedTokens) implements MessageContent {
    }

    record SkillRemoved(String skillName) implements MessageContent {
    }
}
