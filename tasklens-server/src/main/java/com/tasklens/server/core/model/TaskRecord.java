package com.tasklens.server.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * One normalized task utterance pulled out of a log line.
 * Text is always whitespace-collapsed and non-empty.
 */
@Value
@Builder
public class TaskRecord {
    String engineer;
    LogSource source;
    String text;
    long timestampMs;   // 0 when unknown
    String sessionId;
    String project;
    String file;
    int line;           // 1-based
}
