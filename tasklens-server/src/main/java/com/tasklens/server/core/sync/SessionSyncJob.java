package com.tasklens.server.core.sync;

import com.tasklens.server.core.cache.SyncRunHistory;
import com.tasklens.server.core.model.SyncSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * A configured sync run, recorded in the run history.
 */
@Component
@RequiredArgsConstructor
public class SessionSyncJob implements SyncJob {

    private final SessionSyncService syncService;
    private final SyncRunHistory history;

    @Override
    public void run() {
        long runId = history.begin();
        try {
            SyncSummary summary = syncService.pull(syncService.defaultOptions());
            history.succeeded(runId, summary);
        } catch (RuntimeException e) {
            history.failed(runId, e);
            throw e;
        }
    }
}
