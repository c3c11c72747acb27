package com.tasklens.server.core.sync;

import com.tasklens.server.api.SyncStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coalescing scheduler for sync runs. At most one run is in flight; enqueues that arrive while it
 * runs collapse into a single follow-up run. Failures are logged and never reach the caller of
 * {@link #enqueue()}.
 */
@Slf4j
public class SyncCoordinator implements AutoCloseable {

    private final SyncJob job;
    private final ExecutorService executor;
    private final AtomicLong completedRuns = new AtomicLong();

    // guarded by this
    private boolean running;
    private boolean pending;

    public SyncCoordinator(SyncJob job, ExecutorService executor) {
        this.job = job;
        this.executor = executor;
    }

    /**
     * Starts a run now, or marks one as pending if a run is already in flight.
     *
     * @return true if a run was started by this call
     */
    public synchronized boolean enqueue() {
        if (running) {
            pending = true;
            return false;
        }
        running = true;
        return submit();
    }

    public synchronized SyncStatus status() {
        return SyncStatus.builder()
                .running(running)
                .pending(pending)
                .completedRuns(completedRuns.get())
                .build();
    }

    public long completedRuns() {
        return completedRuns.get();
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private void runOnce() {
        try {
            job.run();
        } catch (Exception e) {
            log.error("Session sync failed: {}", e.getMessage(), e);
        } finally {
            completedRuns.incrementAndGet();
            onComplete();
        }
    }

    synchronized void onComplete() {
        if (pending) {
            pending = false;
            submit();
        } else {
            running = false;
        }
    }

    // caller holds the lock
    private boolean submit() {
        try {
            executor.execute(this::runOnce);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Sync executor is shut down, dropping sync request");
            running = false;
            return false;
        }
    }
}
