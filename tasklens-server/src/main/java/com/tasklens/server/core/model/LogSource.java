package com.tasklens.server.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which coding agent produced a log record.
 */
public enum LogSource {
    CLAUDE("claude"),
    CODEX("codex"),
    UNKNOWN("unknown");

    private final String wireName;

    LogSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
