package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasklens.server.core.model.LogSource;
import com.tasklens.server.core.util.JsonFields;

import java.nio.file.Path;

/**
 * Guesses the producing agent from the file location and tell-tale fields, independent of the record layout.
 */
public final class SourceClassifier {

    private static final String CODEX_DIR = ".codex";
    private static final String CLAUDE_DIR = ".claude";

    private SourceClassifier() {
    }

    public static LogSource classify(Path file, JsonNode record) {
        if (hasDirectory(file, CODEX_DIR)
                || JsonFields.isNumber(record, "ts")
                || JsonFields.isText(record, "session_id")) {
            return LogSource.CODEX;
        }
        if (hasDirectory(file, CLAUDE_DIR) || JsonFields.isText(record, "display")) {
            return LogSource.CLAUDE;
        }
        return LogSource.UNKNOWN;
    }

    private static boolean hasDirectory(Path file, String name) {
        Path parent = file == null ? null : file.getParent();
        if (parent == null) {
            return false;
        }
        for (Path segment : parent) {
            if (segment.toString().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
