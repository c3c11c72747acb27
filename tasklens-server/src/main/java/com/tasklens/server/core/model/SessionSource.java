package com.tasklens.server.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Agent that recorded a cached session. Parsed from the third segment of a session cache key.
 */
public enum SessionSource {
    CODEX("codex"),
    CLAUDE("claude"),
    OPENCLAW("openclaw"),
    UNKNOWN("unknown");

    private final String wireName;

    SessionSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static SessionSource fromKeySegment(String segment) {
        String normalized = segment == null ? "" : segment.trim().toLowerCase(Locale.ROOT);
        for (SessionSource source : values()) {
            if (source != UNKNOWN && source.wireName.equals(normalized)) {
                return source;
            }
        }
        return UNKNOWN;
    }
}
