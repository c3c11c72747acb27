package com.tasklens.server.core.parse;

import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SLASH_COMMAND = Pattern.compile("^/[a-z0-9_-]+$", Pattern.CASE_INSENSITIVE);
    private static final int MIN_TASK_LENGTH = 4;

    private TextNormalizer() {
    }

    public static String collapse(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * False for short fragments and bare slash commands such as {@code /clear}.
     */
    public static boolean looksActionable(String text) {
        String collapsed = collapse(text);
        if (collapsed.length() < MIN_TASK_LENGTH) {
            return false;
        }
        return !SLASH_COMMAND.matcher(collapsed).matches();
    }
}
