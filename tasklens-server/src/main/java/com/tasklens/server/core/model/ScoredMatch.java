package com.tasklens.server.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"engineer", "source", "text", "timestampMs", "sessionId", "project", "file", "line", "score"})
public class ScoredMatch {

    public static final int MAX_TEXT_LENGTH = 600;

    String engineer;
    LogSource source;
    String text;
    long timestampMs;
    String sessionId;
    String project;
    String file;
    int line;
    double score;

    public static ScoredMatch of(TaskRecord record, double score) {
        return ScoredMatch.builder()
                .engineer(record.getEngineer())
                .source(record.getSource())
                .text(truncate(record.getText()))
                .timestampMs(record.getTimestampMs())
                .sessionId(record.getSessionId())
                .project(record.getProject())
                .file(record.getFile())
                .line(record.getLine())
                .score(score)
                .build();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        int end = MAX_TEXT_LENGTH;
        // don't split a surrogate pair
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
