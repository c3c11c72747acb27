package com.tasklens.server.core.cache;

import com.tasklens.server.core.model.SyncSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class SyncRunRecord {

    public enum Status {
        RUNNING, SUCCEEDED, FAILED
    }

    long runId;
    Status status;
    Instant startedAt;
    Instant finishedAt;
    String message;
    SyncSummary summary;
}
