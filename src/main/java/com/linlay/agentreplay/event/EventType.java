package com.linlay.agentreplay.event;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum EventType {

    SESSION_START("session.start", false),
    SESSION_END("session.end", false),
    SESSION_FORK("session.fork", false),
    SESSION_BRANCH("session.branch", false),

    MESSAGE_USER("message.user", true),
    MESSAGE_ASSISTANT("message.assistant", true),
    MESSAGE_SYSTEM("message.system", true),
    MESSAGE_DELETED("message.deleted", false),

    TOOL_CALL("tool.call", false),
    TOOL_RESULT("tool.result", false),

    CONFIG_MODEL_SWITCH("config.model_switch", true),
    CONFIG_REASONING_LEVEL("config.reasoning_level", true),

    ERROR_AGENT("error.agent", true),
    ERROR_TOOL("error.tool", true),
    ERROR_PROVIDER("error.provider", true),

    NOTIFICATION_INTERRUPTED("notification.interrupted", true),

    CONTEXT_CLEARED("context.cleared", true),
    COMPACT_BOUNDARY("compact.boundary", true),
    COMPACT_SUMMARY("compact.summary", false),

    SKILL_ADDED("skill.added", false),
    SKILL_REMOVED("skill.removed", true),

    FILE_READ("file.read", false),
    FILE_WRITE("file.write", false),
    FILE_EDIT("file.edit", false),

    WORKTREE_ACQUIRED("worktree.acquired", false),
    WORKTREE_COMMIT("worktree.commit", false),
    WORKTREE_MERGED("worktree.merged", false),
    WORKTREE_RELEASED("worktree.released", false),

    METADATA_UPDATE("metadata.update", false),
    METADATA_TAG("metadata.tag", false),

    STREAM_TURN_START("stream.turn_start", false),
    STREAM_TURN_END("stream.turn_end", false);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;
    private final boolean rendersAsMessage;

    EventType(String wireName, boolean rendersAsMessage) {
        this.wireName = wireName;
        this.rendersAsMessage = rendersAsMessage;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether events of this type contribute a transcript entry. Tool call/result events are
     * consumed through assistant content blocks and never render on their own.
     */
    public boolean rendersAsMessage() {
        return rendersAsMessage;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim()));
    }
}
