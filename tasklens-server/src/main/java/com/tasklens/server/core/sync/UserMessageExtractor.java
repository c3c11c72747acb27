package com.tasklens.server.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasklens.server.core.parse.Timestamps;
import com.tasklens.server.core.util.JsonFields;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads user-authored messages out of a fetched context payload. Messages come in several
 * wrappings: the role may sit on the message, on its {@code content}, or the original agent
 * record may be kept under {@code content.raw}.
 */
public final class UserMessageExtractor {

    private UserMessageExtractor() {
    }

    public static boolean isUserMessage(JsonNode message) {
        if (message == null || !message.isObject()) {
            return false;
        }
        if ("user".equals(JsonFields.text(message, "role"))) {
            return true;
        }
        JsonNode content = JsonFields.object(message, "content");
        if (content == null) {
            return false;
        }
        if ("user".equals(JsonFields.text(content, "role"))) {
            return true;
        }
        return "user".equals(JsonFields.text(JsonFields.object(content, "raw"), "type"));
    }

    public static String extractText(JsonNode message) {
        if (message == null || !message.isObject()) {
            return "";
        }
        JsonNode content = message.get("content");
        String direct = textContent(content);
        if (!direct.isEmpty()) {
            return direct;
        }

        JsonNode raw = content != null && content.isObject() ? content.get("raw") : null;
        String fromRaw = textContent(raw);
        if (!fromRaw.isEmpty()) {
            return fromRaw;
        }
        if (raw != null && raw.isObject()) {
            return textContent(raw.get("message"));
        }
        return "";
    }

    /**
     * First parseable of: content timestamp, metadata timestamp, message timestamp, content creation time.
     */
    public static String extractTimestamp(JsonNode message, String fallbackIso) {
        if (message == null || !message.isObject()) {
            return fallbackIso;
        }
        JsonNode content = JsonFields.object(message, "content");
        JsonNode metadata = JsonFields.object(message, "metadata");
        JsonNode[] candidates = {
                content == null ? null : content.get("timestamp"),
                metadata == null ? null : metadata.get("timestamp"),
                message.get("timestamp"),
                content == null ? null : content.get("created_at")
        };
        for (JsonNode candidate : candidates) {
            long millis = Timestamps.toEpochMillis(candidate);
            if (millis != 0) {
                return Timestamps.toIso(millis);
            }
        }
        return fallbackIso;
    }

    static String textContent(JsonNode value) {
        if (value == null) {
            return "";
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (!value.isObject()) {
            return "";
        }
        for (String field : new String[]{"message", "text", "content"}) {
            String text = JsonFields.text(value, field);
            if (text != null) {
                return text;
            }
        }
        JsonNode parts = value.get("content");
        if (parts == null || !parts.isArray()) {
            return "";
        }
        List<String> texts = new ArrayList<>();
        for (JsonNode part : parts) {
            String text = part.isTextual() ? part.asText() : JsonFields.text(part, "text");
            if (text != null && !text.isEmpty()) {
                texts.add(text);
            }
        }
        return String.join("\n", texts);
    }
}
