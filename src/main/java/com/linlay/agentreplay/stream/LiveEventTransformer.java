package com.linlay.agentreplay.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentreplay.event.ArgumentsFormatter;
import com.linlay.agentreplay.event.TokenUsage;
import com.linlay.agentreplay.transcript.MessageContent;
import com.linlay.agentreplay.transcript.MessageRole;
import com.linlay.agentreplay.transcript.ToolStatus;
import com.linlay.agentreplay.transcript.TranscriptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.linlay.agentreplay.event.JsonNodes.bool;
import static com.linlay.agentreplay.event.JsonNodes.field;
import static com.linlay.agentreplay.event.JsonNodes.firstInteger;
import static com.linlay.agentreplay.event.JsonNodes.firstText;
import static com.linlay.agentreplay.event.JsonNodes.integer;
import static com.linlay.agentreplay.event.JsonNodes.longValue;
import static com.linlay.agentreplay.event.JsonNodes.object;
import static com.linlay.agentreplay.event.JsonNodes.text;

/**
 * Maps live channel events onto transcript messages and incremental state updates.
 * <p>
 * Only tool start, tool end and error events become messages. Deltas, turn boundaries and
 * completion travel as {@link LiveStateUpdate}s; session, tree, sync and system events carry
 * nothing for the transcript. Live messages have no event id, so they get ids from a counter and
 * timestamps from the injected clock.
 */
public class LiveEventTransformer {

    private static final Logger log = LoggerFactory.getLogger(LiveEventTransformer.class);
    private static final String ID_PREFIX = "live_";

    private final ArgumentsFormatter argumentsFormatter;
    private final Clock clock;
    private final AtomicLong idCounter = new AtomicLong(0);

    public LiveEventTransformer(ArgumentsFormatter argumentsFormatter, Clock clock) {
        this.argumentsFormatter = Objects.requireNonNull(argumentsFormatter, "argumentsFormatter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public LiveEventTransformer(ArgumentsFormatter argumentsFormatter) {
        this(argumentsFormatter, Clock.systemUTC());
    }

    public Optional<TranscriptMessage> transform(LiveEvent event) {
        Optional<LiveEventType> type = resolveType(event);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        JsonNode data = event.data();
        return switch (type.get()) {
            case TOOL_START -> toolStart(data);
            case TOOL_END -> toolEnd(data);
            case ERROR -> error(data);
            default -> Optional.empty();
        };
    }

    public Optional<LiveStateUpdate> extractStateUpdate(LiveEvent event) {
        Optional<LiveEventType> type = resolveType(event);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        JsonNode data = event.data();
        return switch (type.get()) {
            case TEXT_DELTA -> Optional.ofNullable(text(data, "delta"))
                    .map(delta -> new LiveStateUpdate.TextDelta(delta, text(data, "accumulated")));
            case THINKING_DELTA -> Optional.ofNullable(text(data, "delta"))
                    .map(LiveStateUpdate.ThinkingDelta::new);
            case TURN_START -> Optional.ofNullable(firstInteger(data, "turn", "turnNumber"))
                    .map(LiveStateUpdate.TurnStart::new);
            case TURN_END -> Optional.ofNullable(firstInteger(data, "turn", "turnNumber"))
                    .map(turn -> new LiveStateUpdate.TurnEnd(
                            turn,
                            TokenUsage.fromNode(object(data, "tokenUsage")),
                            text(data, "stopReason"),
                            longValue(data, "duration")
                    ));
            case COMPLETE -> {
                Integer turns = integer(data, "turns");
                yield Optional.of(new LiveStateUpdate.Complete(
                        turns == null ? 0 : turns,
                        TokenUsage.fromNode(object(data, "tokenUsage")),
                        !Boolean.FALSE.equals(bool(data, "success")),
                        text(data, "error")
                ));
            }
            case TOOL_END -> {
                ToolEnd end = ToolEnd.read(data);
                yield end == null ? Optional.empty() : Optional.of(new LiveStateUpdate.ToolStatusUpdate(
                        end.toolCallId(),
                        end.success() ? ToolStatus.SUCCESS : ToolStatus.ERROR,
                        end.output() != null ? end.output() : end.error(),
                        end.durationMs()
                ));
            }
            default -> Optional.empty();
        };
    }

    public Flux<TranscriptMessage> map(Flux<LiveEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        return events.concatMapIterable(event -> transform(event).map(List::of).orElse(List.of()));
    }

    public Flux<LiveStateUpdate> mapStateUpdates(Flux<LiveEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        return events.concatMapIterable(event -> extractStateUpdate(event).map(List::of).orElse(List.of()));
    }

    private Optional<TranscriptMessage> toolStart(JsonNode data) {
        String toolCallId = text(data, "toolCallId");
        String toolName = text(data, "toolName");
        if (toolCallId == null || toolName == null) {
            log.warn("Skip live tool start without toolCallId or toolName");
            return Optional.empty();
        }
        JsonNode arguments = field(data, "arguments");
        String serialized = arguments != null && arguments.isTextual()
                ? arguments.asText()
                : argumentsFormatter.formatOrEmpty(arguments);
        return Optional.of(message(MessageRole.ASSISTANT, new MessageContent.ToolUse(
                toolCallId,
                toolName,
                serialized,
                ToolStatus.RUNNING,
                null,
                null,
                0
        )));
    }

    private Optional<TranscriptMessage> toolEnd(JsonNode data) {
        ToolEnd end = ToolEnd.read(data);
        if (end == null) {
            log.warn("Skip live tool end without toolCallId or toolName");
            return Optional.empty();
        }
        String content = end.output() != null ? end.output() : end.error() != null ? end.error() : "";
        return Optional.of(message(MessageRole.TOOL_RESULT, new MessageContent.ToolResult(
                end.toolCallId(),
                end.toolName(),
                content,
                !end.success(),
                end.durationMs()
        )));
    }

    private Optional<TranscriptMessage> error(JsonNode data) {
        String message = firstText(data, "message", "error");
        if (message == null) {
            log.warn("Skip live error without message");
            return Optional.empty();
        }
        String code = text(data, "code");
        String text = code == null ? message : "[" + code + "] " + message;
        return Optional.of(message(MessageRole.ASSISTANT, new MessageContent.Error(text)));
    }

    private TranscriptMessage message(MessageRole role, MessageContent content) {
        String id = ID_PREFIX + idCounter.incrementAndGet();
        return new TranscriptMessage(id, role, content, clock.instant(), null, null, null);
    }

    private Optional<LiveEventType> resolveType(LiveEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Optional<LiveEventType> type = LiveEventType.fromWireName(event.type());
        if (type.isEmpty()) {
            log.warn("Skip unknown live event type={}", event.type());
        }
        return type;
    }

    private record ToolEnd(String toolCallId, String toolName, Long durationMs, boolean success, String output, String error) {

        static ToolEnd read(JsonNode data) {
            String toolCallId = text(data, "toolCallId");
            String toolName = text(data, "toolName");
            if (toolCallId == null || toolName == null) {
                return null;
            }
            return new ToolEnd(
                    toolCallId,
                    toolName,
                    longValue(data, "duration"),
                    !Boolean.FALSE.equals(bool(data, "success")),
                    text(data, "output"),
                    text(data, "error")
            );
        }
    }
}
