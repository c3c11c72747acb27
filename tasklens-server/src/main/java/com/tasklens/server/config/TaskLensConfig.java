package com.tasklens.server.config;

import com.tasklens.server.core.sync.SessionSyncJob;
import com.tasklens.server.core.sync.SyncCoordinator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(TaskLensProperties.class)
public class TaskLensConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "queryExecutor", destroyMethod = "shutdown")
    public ExecutorService queryExecutor(TaskLensProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getQuery().getParallelism()),
                namedThreads("task-query"));
    }

    // single thread: the coordinator never has more than one run in flight
    @Bean(destroyMethod = "close")
    public SyncCoordinator syncCoordinator(SessionSyncJob sessionSyncJob) {
        return new SyncCoordinator(sessionSyncJob, Executors.newSingleThreadExecutor(namedThreads("session-sync")));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
