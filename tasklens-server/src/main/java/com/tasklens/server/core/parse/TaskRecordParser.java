package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasklens.server.core.model.LogSource;
import com.tasklens.server.core.model.TaskRecord;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns one decoded log object into zero or one {@link TaskRecord}.
 */
@Component
public class TaskRecordParser {

    public List<TaskRecord> parse(Path file, int line, String engineer, JsonNode record) {
        RecordShape shape = RecordClassifier.classify(record);
        if (!shape.isRecognized()) {
            return List.of();
        }

        String text = TextNormalizer.collapse(shape.getText());
        if (!TextNormalizer.looksActionable(text)) {
            return List.of();
        }

        return List.of(TaskRecord.builder()
                .engineer(engineer)
                .source(resolveSource(shape.getKind(), SourceClassifier.classify(file, record)))
                .text(text)
                .timestampMs(Timestamps.toEpochMillis(shape.getTimestamp()))
                .sessionId(shape.getSessionId())
                .project(shape.getProject())
                .file(file.toString())
                .line(line)
                .build());
    }

    // history layouts imply their agent unless the location or fields say otherwise
    private static LogSource resolveSource(RecordShape.Kind kind, LogSource inferred) {
        if (inferred.isKnown()) {
            return inferred;
        }
        switch (kind) {
            case CODEX_HISTORY:
                return LogSource.CODEX;
            case CLAUDE_HISTORY:
                return LogSource.CLAUDE;
            default:
                return inferred;
        }
    }
}
