package com.tasklens.server.core.sync;

/**
 * The work a {@link SyncCoordinator} runs.
 */
@FunctionalInterface
public interface SyncJob {

    void run() throws Exception;
}
