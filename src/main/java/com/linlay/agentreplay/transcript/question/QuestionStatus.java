package com.linlay.agentreplay.transcript.question;

public enum QuestionStatus {
    /**
     * No user message followed the question yet.
     */
    PENDING,
    /**
     * The next user message carried the answers marker.
     */
    ANSWERED,
    /**
     * The user moved on without answering.
     */
    SUPERSEDED
}
