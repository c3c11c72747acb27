package com.tasklens.server.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceFilter {
    ALL("all"),
    CODEX("codex"),
    CLAUDE("claude"),
    OPENCLAW("openclaw");

    private final String wireName;

    SourceFilter(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean matches(SessionSource source) {
        return this == ALL || wireName.equals(source.wireName());
    }

    /**
     * Parses a filter name; blank means {@link #ALL}.
     *
     * @throws IllegalArgumentException for any other unrecognized value
     */
    public static SourceFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceFilter filter : values()) {
            if (filter.wireName.equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Invalid source filter: " + value);
    }
}
