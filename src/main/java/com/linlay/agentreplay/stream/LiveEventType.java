package com.linlay.agentreplay.stream;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum LiveEventType {

    TEXT_DELTA("agent.text_delta"),
    THINKING_DELTA("agent.thinking_delta"),
    TOOL_START("agent.tool_start"),
    TOOL_END("agent.tool_end"),
    TURN_START("agent.turn_start"),
    TURN_END("agent.turn_end"),
    COMPLETE("agent.complete"),
    ERROR("agent.error"),

    SESSION_CREATED("session.created"),
    SESSION_ENDED("session.ended"),
    SESSION_UPDATED("session.updated"),
    SESSION_FORKED("session.forked"),
    SESSION_REWOUND("session.rewound"),

    EVENTS_NEW("events.new"),
    EVENTS_BATCH("events.batch"),

    TREE_UPDATED("tree.updated"),
    TREE_BRANCH_CREATED("tree.branch_created"),

    SYSTEM_CONNECTED("system.connected"),
    SYSTEM_DISCONNECTED("system.disconnected"),
    SYSTEM_ERROR("system.error");

    private static final Map<String, LiveEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(LiveEventType::wireName, Function.identity()));

    private final String wireName;

    LiveEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<LiveEventType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim()));
    }
}
