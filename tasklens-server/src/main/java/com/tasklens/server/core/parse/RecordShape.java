package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of sniffing a decoded log line: which known record layout it has, plus the fields
 * that layout carries. {@link Kind#UNRECOGNIZED} carries nothing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecordShape {

    public enum Kind {
        /** {@code {"session_id", "ts", "text"}} */
        CODEX_HISTORY,
        /** {@code {"display", "timestamp", "sessionId", "project"}} */
        CLAUDE_HISTORY,
        /** {@code {"type": "user", "message": {"content": ...}}} */
        USER_TRACE,
        UNRECOGNIZED
    }

    public static final RecordShape UNRECOGNIZED = new RecordShape(Kind.UNRECOGNIZED, "", null, null, null);

    Kind kind;
    String text;
    JsonNode timestamp;
    String sessionId;
    String project;

    public static RecordShape codexHistory(String text, JsonNode ts, String sessionId) {
        return new RecordShape(Kind.CODEX_HISTORY, text, ts, sessionId, null);
    }

    public static RecordShape claudeHistory(String display, JsonNode timestamp, String sessionId, String project) {
        return new RecordShape(Kind.CLAUDE_HISTORY, display, timestamp, sessionId, project);
    }

    public static RecordShape userTrace(String text, JsonNode timestamp, String sessionId) {
        return new RecordShape(Kind.USER_TRACE, text, timestamp, sessionId, null);
    }

    public boolean isRecognized() {
        return kind != Kind.UNRECOGNIZED;
    }
}
