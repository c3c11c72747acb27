package com.tasklens.server.core.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tasklens.sync.auto", name = "enabled", havingValue = "true")
public class AutoSyncScheduler {

    private final SyncCoordinator coordinator;

    @Scheduled(fixedDelayString = "${tasklens.sync.auto.interval:PT10M}",
            initialDelayString = "${tasklens.sync.auto.interval:PT10M}")
    public void triggerSync() {
        boolean started = coordinator.enqueue();
        log.debug("Periodic sync {}", started ? "started" : "coalesced into the running sync");
    }
}
