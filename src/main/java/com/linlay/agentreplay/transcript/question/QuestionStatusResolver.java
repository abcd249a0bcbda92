package com.linlay.agentreplay.transcript.question;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.index.CorrelationIndex;

import java.util.List;
import java.util.Objects;

/**
 * Resolves a question's lifecycle by looking at the first user message after it.
 * Tombstoned events and user messages that only feed tool results back to the model are passed
 * over.
 */
public class QuestionStatusResolver {

    private final AnswerMessageParser answerMessageParser;

    public QuestionStatusResolver(AnswerMessageParser answerMessageParser) {
        this.answerMessageParser = Objects.requireNonNull(answerMessageParser, "answerMessageParser must not be null");
    }

    /**
     * @param startPosition position of the event the question was asked in; scanning starts
     *                      right after it
     */
    public Resolution resolve(List<DecodedEvent> orderedEvents, int startPosition, CorrelationIndex index) {
        for (int i = Math.max(startPosition + 1, 0); i < orderedEvents.size(); i++) {
            DecodedEvent event = orderedEvents.get(i);
            if (index.isDeleted(event.id())) {
                continue;
            }
            if (!(event.payload() instanceof EventPayload.UserMessage userMessage) || userMessage.toolResultContext()) {
                continue;
            }
            if (answerMessageParser.isAnswerMessage(userMessage.content())) {
                return new Resolution(QuestionStatus.ANSWERED, userMessage.content());
            }
            return new Resolution(QuestionStatus.SUPERSEDED, null);
        }
        return new Resolution(QuestionStatus.PENDING, null);
    }

    /**
     * @param answerContent the answering message, present only when {@code status} is ANSWERED
     */
    public record Resolution(QuestionStatus status, String answerContent) {
    }
}
