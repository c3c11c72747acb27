package com.tasklens.server.core.query;

import com.tasklens.server.api.TaskQueryRequest;
import com.tasklens.server.api.TaskQueryResult;
import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.model.EngineerLogLocation;
import com.tasklens.server.core.model.ScoredMatch;
import com.tasklens.server.core.model.TaskRecord;
import com.tasklens.server.core.parse.TextNormalizer;
import com.tasklens.server.core.rank.RelevanceScorer;
import com.tasklens.server.core.scan.LogTreeWalker;
import com.tasklens.server.core.scan.TaskExtractor;
import com.tasklens.server.core.util.HomePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * End-to-end task query: walk the team tree, extract every record, score, filter, rank, truncate.
 * Every call rescans the tree; nothing is indexed between calls.
 */
@Slf4j
@Service
public class TaskQueryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 200;

    private final LogTreeWalker walker;
    private final TaskExtractor extractor;
    private final RelevanceScorer scorer;
    private final TaskLensProperties properties;
    private final Executor queryExecutor;
    private final Clock clock;

    public TaskQueryService(LogTreeWalker walker,
                            TaskExtractor extractor,
                            RelevanceScorer scorer,
                            TaskLensProperties properties,
                            @Qualifier("queryExecutor") Executor queryExecutor,
                            Clock clock) {
        this.walker = walker;
        this.extractor = extractor;
        this.scorer = scorer;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
        this.clock = clock;
    }

    public TaskQueryResult query(TaskQueryRequest request) {
        String query = TextNormalizer.collapse(request.getQuery());
        String queryLower = query.toLowerCase(Locale.ROOT);
        Set<String> tokens = RelevanceScorer.tokenize(query);
        int limit = clampLimit(request.getLimit());
        long nowMs = clock.millis();

        String rootSetting = request.getTeamRoot() == null || request.getTeamRoot().isBlank()
                ? properties.getQuery().getTeamRoot()
                : request.getTeamRoot().trim();
        String teamRoot = HomePaths.expand(rootSetting);
        Path root = Path.of(teamRoot);
        if (!Files.exists(root)) {
            log.info("Team root {} does not exist, returning no matches", teamRoot);
            return TaskQueryResult.empty(teamRoot, query);
        }

        List<EngineerLogLocation> locations = walker.discover(root, request.getTeams(), request.getEngineers());

        List<CompletableFuture<List<TaskRecord>>> pending = new ArrayList<>();
        for (EngineerLogLocation location : locations) {
            for (Path file : walker.listJsonlFiles(location.getLogDir())) {
                pending.add(CompletableFuture.supplyAsync(
                        () -> extractor.extract(file, location.getEngineer()), queryExecutor));
            }
        }
        // joined in submission order so ties stay stable between runs
        List<TaskRecord> records = new ArrayList<>();
        for (CompletableFuture<List<TaskRecord>> future : pending) {
            records.addAll(future.join());
        }

        List<ScoredMatch> matches = records.stream()
                .filter(record -> scorer.isEligible(record, queryLower, tokens))
                .map(record -> ScoredMatch.of(record, scorer.score(record, queryLower, tokens, nowMs)))
                .sorted(RelevanceScorer.RANKING)
                .limit(limit)
                .collect(Collectors.toList());

        log.info("Query '{}' scanned {} files from {} engineers, {} records, {} matches",
                query, pending.size(), locations.size(), records.size(), matches.size());

        return TaskQueryResult.builder()
                .teamRoot(teamRoot)
                .query(query)
                .scannedTeams(distinct(locations.stream().map(EngineerLogLocation::getTeam)))
                .scannedEngineers(distinct(locations.stream().map(EngineerLogLocation::getEngineer)))
                .scannedFiles(pending.size())
                .extractedTasks(records.size())
                .matches(matches)
                .build();
    }

    static int clampLimit(Integer limit) {
        int value = limit == null ? DEFAULT_LIMIT : limit;
        return Math.min(Math.max(value, 1), MAX_LIMIT);
    }

    private static List<String> distinct(Stream<String> names) {
        return new ArrayList<>(names.filter(Objects::nonNull).collect(Collectors.toCollection(LinkedHashSet::new)));
    }
}
