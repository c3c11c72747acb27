package com.tasklens.server.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncSummary {
    String outDir;
    int totalSessions;
    int totalUserMessages;
    int failedSessions;
    boolean dryRun;
}
