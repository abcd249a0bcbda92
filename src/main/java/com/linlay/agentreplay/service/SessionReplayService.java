package com.linlay.agentreplay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentreplay.event.ArgumentsFormatter;
import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayloadDecoder;
import com.linlay.agentreplay.event.SessionEvent;
import com.linlay.agentreplay.event.SessionEventReader;
import com.linlay.agentreplay.index.CorrelationIndex;
import com.linlay.agentreplay.index.CorrelationIndexBuilder;
import com.linlay.agentreplay.ordering.EventOrdering;
import com.linlay.agentreplay.state.SessionSnapshot;
import com.linlay.agentreplay.state.SessionStateReducer;
import com.linlay.agentreplay.transcript.ContentBlockInterleaver;
import com.linlay.agentreplay.transcript.EventMessageFormatter;
import com.linlay.agentreplay.transcript.ToolUseMerger;
import com.linlay.agentreplay.transcript.TranscriptMessage;
import com.linlay.agentreplay.transcript.TranscriptReconstructor;
import com.linlay.agentreplay.transcript.question.AnswerMessageParser;
import com.linlay.agentreplay.transcript.question.QuestionArgumentsParser;
import com.linlay.agentreplay.transcript.question.QuestionStatusResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Session replay entry point: order, decode, index, then build transcript and state.
 * <p>
 * Every call works on its own copies and accumulators, so one instance can serve concurrent
 * replays of independent logs.
 */
public class SessionReplayService {

    public static final String DEFAULT_QUESTION_TOOL_NAME = "AskUserQuestion";

    private static final Logger log = LoggerFactory.getLogger(SessionReplayService.class);

    private final SessionEventReader eventReader;
    private final EventPayloadDecoder payloadDecoder;
    private final CorrelationIndexBuilder indexBuilder;
    private final TranscriptReconstructor transcriptReconstructor;
    private final SessionStateReducer stateReducer;

    public SessionReplayService(
            SessionEventReader eventReader,
            EventPayloadDecoder payloadDecoder,
            CorrelationIndexBuilder indexBuilder,
            TranscriptReconstructor transcriptReconstructor,
            SessionStateReducer stateReducer
    ) {
        this.eventReader = Objects.requireNonNull(eventReader, "eventReader must not be null");
        this.payloadDecoder = Objects.requireNonNull(payloadDecoder, "payloadDecoder must not be null");
        this.indexBuilder = Objects.requireNonNull(indexBuilder, "indexBuilder must not be null");
        this.transcriptReconstructor = Objects.requireNonNull(transcriptReconstructor, "transcriptReconstructor must not be null");
        this.stateReducer = Objects.requireNonNull(stateReducer, "stateReducer must not be null");
    }

    /**
     * Wires the engine with the default question tool name, answers marker and placeholders.
     */
    public static SessionReplayService withDefaults(ObjectMapper objectMapper) {
        ArgumentsFormatter argumentsFormatter = new ArgumentsFormatter(objectMapper);
        AnswerMessageParser answerMessageParser = new AnswerMessageParser();
        TranscriptReconstructor reconstructor = new TranscriptReconstructor(
                new EventMessageFormatter(answerMessageParser),
                new ContentBlockInterleaver(
                        new ToolUseMerger(argumentsFormatter),
                        new QuestionArgumentsParser(objectMapper),
                        new QuestionStatusResolver(answerMessageParser),
                        answerMessageParser,
                        DEFAULT_QUESTION_TOOL_NAME
                )
        );
        return new SessionReplayService(
                new SessionEventReader(objectMapper),
                new EventPayloadDecoder(argumentsFormatter),
                new CorrelationIndexBuilder(),
                reconstructor,
                new SessionStateReducer()
        );
    }

    public ReplayResult replay(List<SessionEvent> events, boolean presorted) {
        List<DecodedEvent> decoded = prepare(events, presorted);
        CorrelationIndex index = indexBuilder.build(decoded);
        List<TranscriptMessage> messages = transcriptReconstructor.reconstruct(decoded, index);
        SessionSnapshot snapshot = stateReducer.reduce(decoded, index);
        log.debug("Replayed {} events into {} messages", decoded.size(), messages.size());
        return new ReplayResult(messages, snapshot);
    }

    public List<TranscriptMessage> transcript(List<SessionEvent> events, boolean presorted) {
        List<DecodedEvent> decoded = prepare(events, presorted);
        return transcriptReconstructor.reconstruct(decoded, indexBuilder.build(decoded));
    }

    public SessionSnapshot snapshot(List<SessionEvent> events, boolean presorted) {
        List<DecodedEvent> decoded = prepare(events, presorted);
        return stateReducer.reduce(decoded, indexBuilder.build(decoded));
    }

    /**
     * Replays an ancestor chain, root session first. Segment order is authoritative; each segment
     * is sorted on its own only when {@code sortSegments} is set.
     */
    public ReplayResult replayAncestry(List<List<SessionEvent>> segments, boolean sortSegments) {
        return replay(EventOrdering.stitchAncestry(segments, sortSegments), true);
    }

    public ReplayResult replayJson(String json, boolean presorted) {
        return replay(eventReader.read(json), presorted);
    }

    private List<DecodedEvent> prepare(List<SessionEvent> events, boolean presorted) {
        Objects.requireNonNull(events, "events must not be null");
        List<SessionEvent> ordered = EventOrdering.order(events, presorted);
        List<DecodedEvent> decoded = payloadDecoder.decodeAll(ordered);
        if (decoded.size() < ordered.size()) {
            log.warn("Skipped {} of {} events that could not be decoded", ordered.size() - decoded.size(), ordered.size());
        }
        return decoded;
    }
}
