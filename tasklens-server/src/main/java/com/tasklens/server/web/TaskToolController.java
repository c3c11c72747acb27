package com.tasklens.server.web;

import com.tasklens.server.api.ClaudePromptRequest;
import com.tasklens.server.api.SyncStatus;
import com.tasklens.server.api.TaskQueryRequest;
import com.tasklens.server.api.TaskQueryResult;
import com.tasklens.server.core.query.TaskQueryService;
import com.tasklens.server.core.sync.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
@Slf4j
public class TaskToolController {

    private final TaskQueryService queryService;
    private final SyncCoordinator syncCoordinator;

    /**
     * Ranked task history from the engineers' Claude/Codex logs.
     */
    @PostMapping("/query-engineer-tasks")
    public Mono<TaskQueryResult> queryEngineerTasks(@RequestBody TaskQueryRequest request) {
        if (request.getQuery() == null) {
            throw new IllegalArgumentException("query is required");
        }
        log.info("Received task query: {}", request.getQuery());
        return Mono.fromCallable(() -> queryService.query(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/claude-p")
    public Mono<TaskQueryResult> claudePrompt(@RequestBody ClaudePromptRequest request) {
        if (request.getP() == null) {
            throw new IllegalArgumentException("p is required");
        }
        log.info("Received claude -p query: {}", request.getP());
        return Mono.fromCallable(() -> queryService.query(request.toQueryRequest())
                        .toBuilder()
                        .command(request.toCommand())
                        .build())
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Fire-and-forget: the sync runs in the background, failures only show up in logs and run history.
     */
    @PostMapping("/sync")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SyncStatus sync() {
        boolean started = syncCoordinator.enqueue();
        log.info("Sync requested, {}", started ? "started" : "queued behind the running sync");
        return syncCoordinator.status();
    }
}
