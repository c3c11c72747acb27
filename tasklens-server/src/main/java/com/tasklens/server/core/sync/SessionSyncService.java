package com.tasklens.server.core.sync;

import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.cache.SessionCacheLoader;
import com.tasklens.server.core.cache.SessionRowSelector;
import com.tasklens.server.core.model.DumpResult;
import com.tasklens.server.core.model.SessionCacheRow;
import com.tasklens.server.core.model.SourceFilter;
import com.tasklens.server.core.model.SyncOptions;
import com.tasklens.server.core.model.SyncSummary;
import com.tasklens.server.core.parse.Timestamps;
import com.tasklens.server.core.remote.ContextClient;
import com.tasklens.server.core.util.HomePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pulls recent agent sessions from the daemon cache and the context service into the team log tree.
 * <p>
 * A run reads cache rows, keeps the newest row per session, fetches and writes the selected
 * sessions with a fixed number of concurrent workers and finishes with {@code index.json}.
 * A session that fails to fetch or write is logged and left out of the index; the run only fails
 * when every session does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionSyncService {

    static final int DRY_RUN_PREVIEW = 12;

    private final TaskLensProperties properties;
    private final ApiKeyResolver apiKeyResolver;
    private final SessionCacheLoader cacheLoader;
    private final SessionRowSelector rowSelector;
    private final SessionDumper dumper;
    private final SessionIndexWriter indexWriter;

    /**
     * Options built from {@code tasklens.sync.*}.
     *
     * @throws SyncConfigurationException for an unknown source filter
     */
    public SyncOptions defaultOptions() {
        TaskLensProperties.Sync sync = properties.getSync();
        SourceFilter source;
        try {
            source = SourceFilter.parse(sync.getSource());
        } catch (IllegalArgumentException e) {
            throw new SyncConfigurationException(e.getMessage(), e);
        }
        return SyncOptions.builder()
                .outDir(HomePaths.resolve(sync.getOutDir()))
                .engineerId(sync.getEngineerId())
                .host(sync.getHost())
                .source(source)
                .limit(Math.max(1, sync.getLimit()))
                .baseUrl(ContextClient.stripTrailingSlashes(sync.getBaseUrl()))
                .apiKey(sync.getApiKey())
                .skipRaw(sync.isSkipRaw())
                .dryRun(sync.isDryRun())
                .workers(Math.max(1, sync.getWorkers()))
                .build();
    }

    public SyncSummary pull(SyncOptions options) {
        String apiKey = apiKeyResolver.resolve(options.getApiKey());

        List<SessionCacheRow> selected = rowSelector.select(cacheLoader.loadRows(), options);
        log.info("Found {} sessions in daemon cache (source={}, engineer={}, host={}).",
                selected.size(), options.getSource().wireName(),
                orAll(options.getEngineerId()), orAll(options.getHost()));

        if (options.isDryRun()) {
            selected.stream().limit(DRY_RUN_PREVIEW).forEach(row -> log.info("{} | {} | {} | {} | {} | {}",
                    row.getSource().wireName(), row.getEngineerId(), row.getHost(), row.getSessionId(),
                    row.getContextId(),
                    row.getUpdatedAtUnix() != 0 ? Timestamps.toIsoFromSeconds(row.getUpdatedAtUnix()) : "-"));
            log.info("Dry run complete.");
            return SyncSummary.builder()
                    .outDir(options.getOutDir().toString())
                    .totalSessions(selected.size())
                    .totalUserMessages(0)
                    .failedSessions(0)
                    .dryRun(true)
                    .build();
        }

        createDirectories(options);

        // flatMapSequential keeps the selected order whatever order the fetches finish in
        List<Optional<DumpResult>> outcomes = Flux.fromIterable(selected)
                .flatMapSequential(row -> dumpIsolated(row, options, apiKey), options.getWorkers())
                .collectList()
                .block();

        List<DumpResult> results = outcomes.stream()
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        int failed = outcomes.size() - results.size();
        if (results.isEmpty()) {
            throw new SyncException("All %d selected sessions failed to dump".formatted(selected.size()));
        }

        Path indexPath = indexWriter.write(options, results, failed);
        int totalUserMessages = results.stream().mapToInt(DumpResult::getUserMessages).sum();

        log.info("Dumped {} sessions to {}", results.size(), options.getOutDir());
        log.info("Total user messages: {}", totalUserMessages);
        log.info("Index file: {}", indexPath);
        if (failed > 0) {
            log.warn("{} sessions failed and were left out of the index", failed);
        }

        return SyncSummary.builder()
                .outDir(options.getOutDir().toString())
                .totalSessions(results.size())
                .totalUserMessages(totalUserMessages)
                .failedSessions(failed)
                .dryRun(false)
                .build();
    }

    private Mono<Optional<DumpResult>> dumpIsolated(SessionCacheRow row, SyncOptions options, String apiKey) {
        return dumper.dump(row, options, apiKey)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("Failed to dump session {} (context {}): {}",
                            row.getSessionId(), row.getContextId(), e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private static void createDirectories(SyncOptions options) {
        try {
            Files.createDirectories(options.getOutDir());
            if (!options.isSkipRaw()) {
                Files.createDirectories(options.getOutDir().resolve(SessionDumper.RAW_DIR));
            }
        } catch (IOException e) {
            throw new SyncException("Unable to create " + options.getOutDir(), e);
        }
    }

    private static String orAll(String value) {
        return value == null || value.isBlank() ? "all" : value;
    }
}
