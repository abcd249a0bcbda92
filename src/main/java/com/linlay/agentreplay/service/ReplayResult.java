package com.linlay.agentreplay.service;

import com.linlay.agentreplay.state.SessionSnapshot;
import com.linlay.agentreplay.transcript.TranscriptMessage;

import java.util.List;
import java.util.Objects;

public record ReplayResult(List<TranscriptMessage> messages, SessionSnapshot snapshot) {

    public ReplayResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }
}
