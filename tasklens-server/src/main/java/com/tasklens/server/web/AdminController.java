package com.tasklens.server.web;

import com.tasklens.server.api.SyncStatus;
import com.tasklens.server.core.cache.SyncRunHistory;
import com.tasklens.server.core.cache.SyncRunRecord;
import com.tasklens.server.core.sync.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final SyncCoordinator syncCoordinator;
    private final SyncRunHistory runHistory;

    @GetMapping("/sync/status")
    public SyncStatus syncStatus() {
        return syncCoordinator.status();
    }

    // newest first
    @GetMapping("/sync/runs")
    public List<SyncRunRecord> syncRuns() {
        return runHistory.recent();
    }
}
