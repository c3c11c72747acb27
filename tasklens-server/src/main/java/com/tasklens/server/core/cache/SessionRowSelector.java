package com.tasklens.server.core.cache;

import com.tasklens.server.core.model.SessionCacheRow;
import com.tasklens.server.core.model.SyncOptions;
import com.tasklens.server.core.sync.NoMatchingSessionsException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Filters cache rows by engineer, host and source, keeps the newest row per session,
 * and returns the newest {@code limit} sessions.
 */
@Component
public class SessionRowSelector {

    static final Comparator<SessionCacheRow> NEWEST_FIRST =
            Comparator.comparingLong(SessionCacheRow::getUpdatedAtUnix).reversed()
                    .thenComparing(SessionCacheRow::getCacheKey);

    /**
     * @throws NoMatchingSessionsException when no row passes the filters
     */
    public List<SessionCacheRow> select(List<SessionCacheRow> rows, SyncOptions options) {
        Map<String, SessionCacheRow> bySession = new LinkedHashMap<>();
        for (SessionCacheRow row : rows) {
            if (!matches(row, options)) {
                continue;
            }
            bySession.merge(row.sessionKey(), row, SessionRowSelector::newer);
        }
        if (bySession.isEmpty()) {
            throw new NoMatchingSessionsException("No matching session contexts found in daemon cache.");
        }

        return bySession.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(1, options.getLimit()))
                .collect(Collectors.toList());
    }

    private static boolean matches(SessionCacheRow row, SyncOptions options) {
        if (isSet(options.getEngineerId()) && !options.getEngineerId().equals(row.getEngineerId())) {
            return false;
        }
        if (isSet(options.getHost()) && !options.getHost().equals(row.getHost())) {
            return false;
        }
        return options.getSource().matches(row.getSource());
    }

    // equal update times: the greater content id wins, whatever the input order
    static SessionCacheRow newer(SessionCacheRow current, SessionCacheRow candidate) {
        if (candidate.getUpdatedAtUnix() != current.getUpdatedAtUnix()) {
            return candidate.getUpdatedAtUnix() > current.getUpdatedAtUnix() ? candidate : current;
        }
        return candidate.getContextId().compareTo(current.getContextId()) > 0 ? candidate : current;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
