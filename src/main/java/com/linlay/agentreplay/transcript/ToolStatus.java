package com.linlay.agentreplay.transcript;

public enum ToolStatus {
    RUNNING,
    SUCCESS,
    ERROR
}
