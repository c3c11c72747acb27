package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasklens.server.core.util.JsonFields;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which known layout a decoded log object has. Layouts are tried in a fixed order and the
 * first match wins: Codex history, Claude history, then user session traces.
 */
public final class RecordClassifier {

    private RecordClassifier() {
    }

    public static RecordShape classify(JsonNode record) {
        if (record == null || !record.isObject()) {
            return RecordShape.UNRECOGNIZED;
        }

        String text = JsonFields.text(record, "text");
        JsonNode ts = record.get("ts");
        if (text != null && isNumberOrString(ts)) {
            return RecordShape.codexHistory(text, ts, JsonFields.text(record, "session_id"));
        }

        String display = JsonFields.text(record, "display");
        JsonNode timestamp = record.get("timestamp");
        if (display != null && isNumberOrString(timestamp)) {
            return RecordShape.claudeHistory(display, timestamp,
                    JsonFields.text(record, "sessionId"), JsonFields.text(record, "project"));
        }

        if ("user".equals(JsonFields.text(record, "type"))) {
            String sessionId = JsonFields.text(record, "sessionId");
            if (sessionId == null) {
                sessionId = JsonFields.text(record, "session_id");
            }
            return RecordShape.userTrace(messageText(record.get("message")), timestamp, sessionId);
        }

        return RecordShape.UNRECOGNIZED;
    }

    private static boolean isNumberOrString(JsonNode node) {
        return node != null && (node.isNumber() || node.isTextual());
    }

    private static String messageText(JsonNode message) {
        if (message == null) {
            return "";
        }
        if (message.isTextual()) {
            return message.asText();
        }
        if (message.isObject() && message.has("content")) {
            return contentText(message.get("content"));
        }
        return "";
    }

    /**
     * Content is either a plain string or an array of strings / {@code {"text": ...}} parts.
     */
    static String contentText(JsonNode content) {
        if (content == null) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode part : content) {
            if (part.isTextual()) {
                parts.add(part.asText());
            } else if (JsonFields.isText(part, "text")) {
                parts.add(part.get("text").asText());
            }
        }
        return String.join("\n", parts);
    }
}
