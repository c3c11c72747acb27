package com.tasklens.server.api;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncStatus {
    boolean running;
    boolean pending;
    long completedRuns;
}
