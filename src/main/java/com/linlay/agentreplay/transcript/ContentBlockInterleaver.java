package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.ContentBlock;
import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.index.ToolCallDetails;
import com.linlay.agentreplay.transcript.question.AnswerMessageParser;
import com.linlay.agentreplay.transcript.question.QuestionAnswer;
import com.linlay.agentreplay.transcript.question.QuestionArgumentsParser;
import com.linlay.agentreplay.transcript.question.QuestionSet;
import com.linlay.agentreplay.transcript.question.QuestionStatusResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands one generative-turn event into transcript messages following its content blocks in
 * streaming order.
 * <p>
 * Text that follows an interactive question in the same turn is dropped: it is a caption for a
 * question the user has not seen answered yet.
 */
public class ContentBlockInterleaver {

    private static final Logger log = LoggerFactory.getLogger(ContentBlockInterleaver.class);

    private final ToolUseMerger toolUseMerger;
    private final QuestionArgumentsParser questionArgumentsParser;
    private final QuestionStatusResolver questionStatusResolver;
    private final AnswerMessageParser answerMessageParser;
    private final String questionToolName;

    public ContentBlockInterleaver(
            ToolUseMerger toolUseMerger,
            QuestionArgumentsParser questionArgumentsParser,
            QuestionStatusResolver questionStatusResolver,
            AnswerMessageParser answerMessageParser,
            String questionToolName
    ) {
        this.toolUseMerger = Objects.requireNonNull(toolUseMerger, "toolUseMerger must not be null");
        this.questionArgumentsParser = Objects.requireNonNull(questionArgumentsParser, "questionArgumentsParser must not be null");
        this.questionStatusResolver = Objects.requireNonNull(questionStatusResolver, "questionStatusResolver must not be null");
        this.answerMessageParser = Objects.requireNonNull(answerMessageParser, "answerMessageParser must not be null");
        this.questionToolName = Objects.requireNonNull(questionToolName, "questionToolName must not be null");
    }

    List<TranscriptMessage> expand(DecodedEvent event, EventPayload.AssistantMessage turn, ReconstructionContext context) {
        List<TranscriptMessage> messages = new ArrayList<>();
        boolean skipTextAfterQuestion = false;

        for (ContentBlock block : turn.content()) {
            if (block instanceof ContentBlock.Thinking thinking) {
                if (!thinking.text().isEmpty()) {
                    messages.add(message(event, turn, messages.size(), new MessageContent.Thinking(thinking.text()), turn.turn()));
                }
            } else if (block instanceof ContentBlock.Text text) {
                if (!text.text().isEmpty() && !skipTextAfterQuestion) {
                    messages.add(message(event, turn, messages.size(), new MessageContent.Text(text.text()), turn.turn()));
                }
            } else if (block instanceof ContentBlock.ToolUse toolUse) {
                if (questionToolName.equals(toolUseMerger.resolveName(toolUse, context.index()))) {
                    skipTextAfterQuestion = true;
                    Optional<MessageContent.Question> question = question(event, toolUse, context);
                    if (question.isPresent()) {
                        messages.add(message(event, turn, messages.size(), question.get(), turn.turn()));
                    }
                } else {
                    MessageContent.ToolUse merged = toolUseMerger.merge(toolUse, context.index(), turn.turn());
                    messages.add(message(event, turn, messages.size(), merged, merged.turn()));
                }
            }
        }
        return messages;
    }

    private Optional<MessageContent.Question> question(DecodedEvent event, ContentBlock.ToolUse toolUse, ReconstructionContext context) {
        String arguments = toolUseMerger.resolveArguments(toolUse, context.index());
        Optional<QuestionSet> questionSet = questionArgumentsParser.parse(arguments);
        if (questionSet.isEmpty()) {
            log.warn("Skip question with unparseable arguments eventId={}, toolCallId={}", event.id(), toolUse.id());
            return Optional.empty();
        }

        int start = context.index().toolCall(toolUse.id())
                .map(ToolCallDetails::eventId)
                .map(context::positionOf)
                .filter(position -> position >= 0)
                .orElseGet(() -> context.positionOf(event.id()));
        QuestionStatusResolver.Resolution resolution = questionStatusResolver.resolve(context.orderedEvents(), start, context.index());
        Map<String, QuestionAnswer> answers = answerMessageParser.parse(resolution.answerContent(), questionSet.get());
        return Optional.of(new MessageContent.Question(toolUse.id(), questionSet.get(), answers, resolution.status()));
    }

    private TranscriptMessage message(
            DecodedEvent event,
            EventPayload.AssistantMessage turn,
            int ordinal,
            MessageContent content,
            int turnNumber
    ) {
        String id = ordinal == 0 ? event.id() : event.id() + "#" + ordinal;
        TurnMetadata metadata = ordinal == 0 ? metadata(turn) : null;
        return new TranscriptMessage(id, MessageRole.ASSISTANT, content, event.timestamp(), event.id(), turnNumber, metadata);
    }

    private TurnMetadata metadata(EventPayload.AssistantMessage turn) {
        Boolean hasThinking = turn.hasThinking();
        if (hasThinking == null) {
            hasThinking = turn.content().stream()
                    .anyMatch(block -> block instanceof ContentBlock.Thinking thinking && !thinking.text().isEmpty());
        }
        return new TurnMetadata(turn.tokenUsage(), turn.model(), turn.latencyMs(), hasThinking, turn.stopReason());
    }
}
