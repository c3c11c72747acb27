package com.tasklens.server.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.model.SyncSummary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Recent sync runs, kept in memory only. Oldest entries are evicted past the configured size or after a day.
 */
@Component
public class SyncRunHistory {

    private static final Duration RETENTION = Duration.ofHours(24);

    private final Cache<Long, SyncRunRecord> runs;
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public SyncRunHistory(TaskLensProperties properties, Clock clock) {
        this.clock = clock;
        this.runs = Caffeine.newBuilder()
                .maximumSize(Math.max(1, properties.getSync().getHistorySize()))
                .expireAfterWrite(RETENTION)
                .build();
    }

    public long begin() {
        long runId = sequence.incrementAndGet();
        runs.put(runId, SyncRunRecord.builder()
                .runId(runId)
                .status(SyncRunRecord.Status.RUNNING)
                .startedAt(clock.instant())
                .build());
        return runId;
    }

    public void succeeded(long runId, SyncSummary summary) {
        runs.asMap().computeIfPresent(runId, (id, record) -> record.toBuilder()
                .status(SyncRunRecord.Status.SUCCEEDED)
                .finishedAt(clock.instant())
                .summary(summary)
                .build());
    }

    public void failed(long runId, Throwable error) {
        runs.asMap().computeIfPresent(runId, (id, record) -> record.toBuilder()
                .status(SyncRunRecord.Status.FAILED)
                .finishedAt(clock.instant())
                .message(error.getMessage())
                .build());
    }

    /**
     * Newest first.
     */
    public List<SyncRunRecord> recent() {
        return runs.asMap().values().stream()
                .sorted(Comparator.comparingLong(SyncRunRecord::getRunId).reversed())
                .collect(Collectors.toList());
    }
}
