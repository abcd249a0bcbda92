package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.transcript.question.AnswerMessageParser;

import java.util.Objects;
import java.util.Optional;

/**
 * Formats events that map to at most one transcript message. Generative turns are expanded by
 * {@link ContentBlockInterleaver} instead.
 */
public class EventMessageFormatter {

    private final AnswerMessageParser answerMessageParser;

    public EventMessageFormatter(AnswerMessageParser answerMessageParser) {
        this.answerMessageParser = Objects.requireNonNull(answerMessageParser, "answerMessageParser must not be null");
    }

    public Optional<TranscriptMessage> format(DecodedEvent event) {
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.UserMessage user) {
            return formatUser(event, user);
        }
        if (payload instanceof EventPayload.SystemMessage system) {
            return message(event, MessageRole.SYSTEM, new MessageContent.Text(system.content()), null);
        }
        if (payload instanceof EventPayload.Interrupted interrupted) {
            return message(event, MessageRole.SYSTEM, new MessageContent.Interrupted(), interrupted.turn());
        }
        if (payload instanceof EventPayload.ModelSwitch modelSwitch) {
            return message(event, MessageRole.SYSTEM,
                    new MessageContent.ModelChange(modelSwitch.previousModel(), modelSwitch.newModel()), null);
        }
        if (payload instanceof EventPayload.ReasoningLevel level) {
            if (level.previousLevel() == null || level.newLevel() == null) {
                return Optional.empty();
            }
            return message(event, MessageRole.SYSTEM, new MessageContent.ReasoningLevelChange(
                    capitalize(level.previousLevel()),
                    capitalize(level.newLevel())
            ), null);
        }
        if (payload instanceof EventPayload.AgentError error) {
            return message(event, MessageRole.ASSISTANT,
                    new MessageContent.Error(withCode(error.code(), error.error())), null);
        }
        if (payload instanceof EventPayload.ToolError error) {
            String text = "Tool '" + error.toolName() + "' failed: " + error.error();
            return message(event, MessageRole.ASSISTANT, new MessageContent.Error(withCode(error.code(), text)), null);
        }
        if (payload instanceof EventPayload.ProviderError error) {
            String text = withCode(error.code(), error.provider() + " error: " + error.error());
            if (error.retryable() && error.retryAfter() != null) {
                text += " (retrying in " + error.retryAfter() + "ms)";
            }
            return message(event, MessageRole.ASSISTANT, new MessageContent.Error(text), null);
        }
        if (payload instanceof EventPayload.ContextCleared cleared) {
            return message(event, MessageRole.SYSTEM,
                    new MessageContent.ContextCleared(cleared.tokensBefore(), cleared.tokensAfter()), null);
        }
        if (payload instanceof EventPayload.CompactBoundary boundary) {
            return message(event, MessageRole.SYSTEM,
                    new MessageContent.CompactionBoundary(boundary.originalTokens(), boundary.compactedTokens()), null);
        }
        if (payload instanceof EventPayload.SkillRemoved skill) {
            return message(event, MessageRole.SYSTEM, new MessageContent.SkillRemoved(skill.skillName()), null);
        }
        return Optional.empty();
    }

    private Optional<TranscriptMessage> formatUser(DecodedEvent event, EventPayload.UserMessage user) {
        if (user.toolResultContext()) {
            return Optional.empty();
        }
        boolean hasAttachments = user.imageCount() != null && user.imageCount() > 0;
        if (user.content().isEmpty() && !hasAttachments && user.skills().isEmpty()) {
            return Optional.empty();
        }
        MessageContent content = answerMessageParser.isAnswerMessage(user.content())
                ? new MessageContent.AnsweredQuestions(answerMessageParser.countSections(user.content()))
                : new MessageContent.Text(user.content());
        return message(event, MessageRole.USER, content, user.turn());
    }

    private Optional<TranscriptMessage> message(DecodedEvent event, MessageRole role, MessageContent content, Integer turn) {
        return Optional.of(new TranscriptMessage(event.id(), role, content, event.timestamp(), event.id(), turn, null));
    }

    private static String withCode(String code, String text) {
        return code == null ? text : "[" + code + "] " + text;
    }

    static String capitalize(String level) {
        StringBuilder result = new StringBuilder(level.length());
        boolean wordStart = true;
        for (char ch : level.toCharArray()) {
            if (Character.isWhitespace(ch)) {
                wordStart = true;
                result.append(ch);
            } else if (wordStart) {
                result.append(Character.toUpperCase(ch));
                wordStart = false;
            } else {
                result.append(Character.toLowerCase(ch));
            }
        }
        return result.toString();
    }
}
