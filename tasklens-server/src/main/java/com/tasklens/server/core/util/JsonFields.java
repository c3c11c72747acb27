package com.tasklens.server.core.util;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Returns the field's value only when it is a JSON string, otherwise null.
     */
    public static String text(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) {
            return null;
        }
        JsonNode value = parent.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    public static boolean isText(JsonNode parent, String field) {
        return text(parent, field) != null;
    }

    public static boolean isNumber(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) {
            return false;
        }
        JsonNode value = parent.get(field);
        return value != null && value.isNumber();
    }

    /**
     * Returns the child object, or null when absent or not an object.
     */
    public static JsonNode object(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) {
            return null;
        }
        JsonNode value = parent.get(field);
        return value != null && value.isObject() ? value : null;
    }
}
