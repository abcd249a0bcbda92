package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.linlay.agentreplay.event.JsonNodes.bool;
import static com.linlay.agentreplay.event.JsonNodes.boolOrFalse;
import static com.linlay.agentreplay.event.JsonNodes.field;
import static com.linlay.agentreplay.event.JsonNodes.firstInteger;
import static com.linlay.agentreplay.event.JsonNodes.firstLong;
import static com.linlay.agentreplay.event.JsonNodes.firstText;
import static com.linlay.agentreplay.event.JsonNodes.integer;
import static com.linlay.agentreplay.event.JsonNodes.longValue;
import static com.linlay.agentreplay.event.JsonNodes.object;
import static com.linlay.agentreplay.event.JsonNodes.stringList;
import static com.linlay.agentreplay.event.JsonNodes.text;

/**
 * Boundary decode from the loosely typed wire payload into {@link EventPayload} variants.
 * <p>
 * Decoding never throws for bad input: an unknown type or a payload missing a required field
 * yields {@link Optional#empty()} and a warning, and the caller drops that event's contribution.
 */
public class EventPayloadDecoder {

    private static final Logger log = LoggerFactory.getLogger(EventPayloadDecoder.class);

    private final ArgumentsFormatter argumentsFormatter;

    public EventPayloadDecoder(ArgumentsFormatter argumentsFormatter) {
        this.argumentsFormatter = Objects.requireNonNull(argumentsFormatter, "argumentsFormatter must not be null");
    }

    public List<DecodedEvent> decodeAll(List<SessionEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        List<DecodedEvent> decoded = new ArrayList<>(events.size());
        for (SessionEvent event : events) {
            if (event == null) {
                continue;
            }
            decode(event).ifPresent(decoded::add);
        }
        return List.copyOf(decoded);
    }

    public Optional<DecodedEvent> decode(SessionEvent event) {
        Optional<EventType> type = EventType.fromWireName(event.type());
        if (type.isEmpty()) {
            log.warn("Skip event with unknown type id={}, type={}", event.id(), event.type());
            return Optional.empty();
        }
        try {
            EventPayload payload = decodePayload(type.get(), event.payload());
            return Optional.of(new DecodedEvent(event, type.get(), payload));
        } catch (IllegalArgumentException ex) {
            log.warn("Skip malformed event id={}, type={}: {}", event.id(), event.type(), ex.getMessage());
            return Optional.empty();
        }
    }

    private EventPayload decodePayload(EventType type, JsonNode payload) {
        return switch (type) {
            case SESSION_START -> new EventPayload.SessionStart(
                    text(payload, "workingDirectory"),
                    text(payload, "model"),
                    text(payload, "provider"),
                    text(payload, "title"),
                    stringList(payload, "tags")
            );
            case SESSION_END -> new EventPayload.SessionEnd(text(payload, "reason"), text(payload, "summary"));
            case SESSION_FORK -> new EventPayload.SessionFork(
                    text(payload, "sourceSessionId"),
                    text(payload, "sourceEventId"),
                    text(payload, "name")
            );
            case SESSION_BRANCH -> new EventPayload.SessionBranch(
                    text(payload, "branchId"),
                    text(payload, "name"),
                    text(payload, "description")
            );
            case MESSAGE_USER -> decodeUserMessage(payload);
            case MESSAGE_ASSISTANT -> decodeAssistantMessage(payload);
            case MESSAGE_SYSTEM -> new EventPayload.SystemMessage(text(payload, "content"), text(payload, "source"));
            case MESSAGE_DELETED -> new EventPayload.MessageDeleted(
                    text(payload, "targetEventId"),
                    text(payload, "targetType"),
                    text(payload, "reason")
            );
            case TOOL_CALL -> new EventPayload.ToolCall(
                    firstText(payload, "toolCallId", "id"),
                    text(payload, "name"),
                    arguments(payload),
                    turnOrDefault(payload)
            );
            case TOOL_RESULT -> new EventPayload.ToolResult(
                    text(payload, "toolCallId"),
                    text(payload, "content"),
                    boolOrFalse(payload, "isError"),
                    firstLong(payload, "duration", "durationMs"),
                    bool(payload, "truncated"),
                    stringList(payload, "affectedFiles"),
                    text(payload, "name"),
                    arguments(payload)
            );
            case CONFIG_MODEL_SWITCH -> new EventPayload.ModelSwitch(
                    text(payload, "previousModel"),
                    firstText(payload, "newModel", "model"),
                    text(payload, "reason")
            );
            case CONFIG_REASONING_LEVEL -> new EventPayload.ReasoningLevel(
                    text(payload, "previousLevel"),
                    text(payload, "newLevel")
            );
            case ERROR_AGENT -> new EventPayload.AgentError(
                    firstText(payload, "error", "message"),
                    text(payload, "code"),
                    boolOrFalse(payload, "recoverable")
            );
            case ERROR_TOOL -> new EventPayload.ToolError(
                    text(payload, "toolName"),
                    text(payload, "toolCallId"),
                    text(payload, "error"),
                    text(payload, "code")
            );
            case ERROR_PROVIDER -> new EventPayload.ProviderError(
                    text(payload, "provider"),
                    text(payload, "error"),
                    text(payload, "code"),
                    boolOrFalse(payload, "retryable"),
                    longValue(payload, "retryAfter")
            );
            case NOTIFICATION_INTERRUPTED -> new EventPayload.Interrupted(integer(payload, "turn"));
            case CONTEXT_CLEARED -> new EventPayload.ContextCleared(
                    requiredLong(payload, "tokensBefore"),
                    requiredLong(payload, "tokensAfter")
            );
            case COMPACT_BOUNDARY -> {
                JsonNode range = object(payload, "range");
                yield new EventPayload.CompactBoundary(
                        text(range, "from"),
                        text(range, "to"),
                        longOrZero(payload, "originalTokens"),
                        longOrZero(payload, "compactedTokens")
                );
            }
            case COMPACT_SUMMARY -> new EventPayload.CompactSummary(
                    text(payload, "summary"),
                    text(payload, "boundaryEventId"),
                    stringList(payload, "keyDecisions"),
                    stringList(payload, "filesModified")
            );
            case SKILL_ADDED -> new EventPayload.SkillAdded(text(payload, "skillName"));
            case SKILL_REMOVED -> new EventPayload.SkillRemoved(text(payload, "skillName"));
            case FILE_READ -> {
                JsonNode lines = object(payload, "lines");
                yield new EventPayload.FileRead(text(payload, "path"), integer(lines, "start"), integer(lines, "end"));
            }
            case FILE_WRITE -> new EventPayload.FileWrite(
                    text(payload, "path"),
                    text(payload, "contentHash"),
                    longOrZero(payload, "size")
            );
            case FILE_EDIT -> new EventPayload.FileEdit(
                    text(payload, "path"),
                    text(payload, "oldString"),
                    text(payload, "newString"),
                    text(payload, "diff")
            );
            case WORKTREE_ACQUIRED -> new EventPayload.WorktreeAcquired(
                    text(payload, "path"),
                    text(payload, "branch"),
                    text(payload, "baseCommit"),
                    boolOrFalse(payload, "isolated")
            );
            case WORKTREE_COMMIT -> new EventPayload.WorktreeCommit(
                    firstText(payload, "commitHash", "hash"),
                    text(payload, "message"),
                    stringList(payload, "filesChanged"),
                    integer(payload, "insertions"),
                    integer(payload, "deletions")
            );
            case WORKTREE_MERGED -> new EventPayload.WorktreeMerged(
                    text(payload, "sourceBranch"),
                    text(payload, "targetBranch"),
                    text(payload, "mergeCommit"),
                    text(payload, "strategy")
            );
            case WORKTREE_RELEASED -> new EventPayload.WorktreeReleased(
                    text(payload, "finalCommit"),
                    boolOrFalse(payload, "deleted"),
                    boolOrFalse(payload, "branchPreserved")
            );
            case METADATA_UPDATE -> new EventPayload.MetadataUpdate(
                    text(payload, "key"),
                    field(payload, "previousValue"),
                    field(payload, "newValue")
            );
            case METADATA_TAG -> new EventPayload.MetadataTag(
                    EventPayload.TagAction.parse(text(payload, "action")),
                    text(payload, "tag")
            );
            case STREAM_TURN_START -> new EventPayload.TurnStart(turnOrDefault(payload));
            case STREAM_TURN_END -> new EventPayload.TurnEnd(turnOrDefault(payload), tokenUsage(payload));
        };
    }

    private EventPayload.UserMessage decodeUserMessage(JsonNode payload) {
        JsonNode content = field(payload, "content");
        String text = null;
        boolean toolResultContext = false;
        if (content != null && content.isTextual()) {
            text = content.asText();
        } else if (content != null && content.isArray()) {
            List<String> texts = new ArrayList<>();
            int toolResults = 0;
            for (JsonNode block : content) {
                String blockType = text(block, "type");
                if ("tool_result".equals(blockType)) {
                    toolResults++;
                } else if ("text".equals(blockType)) {
                    String blockText = text(block, "text");
                    if (blockText != null) {
                        texts.add(blockText);
                    }
                }
            }
            text = String.join("\n", texts);
            toolResultContext = toolResults > 0 && toolResults == content.size();
        }
        return new EventPayload.UserMessage(
                text,
                toolResultContext,
                turnOrDefault(payload),
                integer(payload, "imageCount"),
                stringList(payload, "skills")
        );
    }

    private EventPayload.AssistantMessage decodeAssistantMessage(JsonNode payload) {
        List<ContentBlock> blocks = new ArrayList<>();
        JsonNode content = field(payload, "content");
        if (content != null && content.isArray()) {
            for (JsonNode block : content) {
                blocks.add(decodeBlock(block));
            }
        } else if (content != null && content.isTextual()) {
            blocks.add(new ContentBlock.Text(content.asText()));
        } else {
            String legacyText = text(payload, "text");
            if (legacyText != null) {
                blocks.add(new ContentBlock.Text(legacyText));
            }
        }

        return new EventPayload.AssistantMessage(
                blocks,
                turnOrDefault(payload),
                tokenUsage(payload),
                contextWindowTokens(payload),
                text(payload, "stopReason"),
                firstLong(payload, "latency", "latencyMs"),
                text(payload, "model"),
                bool(payload, "hasThinking"),
                bool(payload, "interrupted")
        );
    }

    private ContentBlock decodeBlock(JsonNode block) {
        String type = text(block, "type");
        if (type == null) {
            return new ContentBlock.Unsupported(null);
        }
        return switch (type) {
            case "text" -> new ContentBlock.Text(text(block, "text"));
            case "thinking" -> new ContentBlock.Thinking(firstText(block, "thinking", "text"));
            case "tool_use" -> {
                String id = text(block, "id");
                // an empty id still renders, it just never correlates with a call or result
                if (id == null) {
                    log.debug("Ignore tool_use block without id");
                    yield new ContentBlock.Unsupported(type);
                }
                yield new ContentBlock.ToolUse(id, text(block, "name"), object(block, "input"));
            }
            default -> new ContentBlock.Unsupported(type);
        };
    }

    private String arguments(JsonNode payload) {
        JsonNode arguments = field(payload, "arguments");
        if (arguments == null) {
            return null;
        }
        if (arguments.isTextual()) {
            return arguments.asText();
        }
        return argumentsFormatter.format(arguments);
    }

    private TokenUsage tokenUsage(JsonNode payload) {
        return TokenUsage.fromNode(object(payload, "tokenUsage"));
    }

    private Long contextWindowTokens(JsonNode payload) {
        JsonNode computed = object(object(payload, "tokenRecord"), "computed");
        Long fromRecord = longValue(computed, "contextWindowTokens");
        if (fromRecord != null) {
            return fromRecord;
        }
        return longValue(object(payload, "normalizedUsage"), "contextWindowTokens");
    }

    private int turnOrDefault(JsonNode payload) {
        Integer turn = firstInteger(payload, "turn", "turnNumber");
        return turn == null ? 1 : turn;
    }

    private long requiredLong(JsonNode payload, String fieldName) {
        Long value = longValue(payload, fieldName);
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must be an integral number");
        }
        return value;
    }

    private long longOrZero(JsonNode payload, String fieldName) {
        Long value = longValue(payload, fieldName);
        return value == null ? 0L : value;
    }
}
