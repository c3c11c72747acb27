package com.tasklens.server.core.cache;

import com.tasklens.server.core.dao.SessionCacheQuery;
import com.tasklens.server.core.model.SessionCacheRow;
import com.tasklens.server.core.model.SessionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads session pointer rows from the cache, newest first. Rows whose key does not follow
 * {@code ctx:session:<source>:<host>:<engineerId>:<sessionId...>} are dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCacheLoader {

    static final String LOAD_SESSIONS_SQL = """
            SELECT cache_key, context_id, updated_at
            FROM context_cache
            WHERE cache_key LIKE 'ctx:session:%'
            ORDER BY updated_at DESC;
            """.strip();

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private final SessionCacheQuery cacheQuery;

    public List<SessionCacheRow> loadRows() {
        List<List<String>> raw = cacheQuery.queryRows(LOAD_SESSIONS_SQL);
        List<SessionCacheRow> rows = new ArrayList<>(raw.size());
        for (List<String> fields : raw) {
            SessionCacheRow row = decode(fields);
            if (row != null) {
                rows.add(row);
            }
        }
        log.debug("Decoded {} of {} session cache rows", rows.size(), raw.size());
        return rows;
    }

    /**
     * @return the decoded row, or null when the key or content id is unusable
     */
    static SessionCacheRow decode(List<String> fields) {
        if (fields.size() < 2) {
            return null;
        }
        String cacheKey = fields.get(0);
        String contextId = fields.get(1);
        if (cacheKey == null || cacheKey.isEmpty() || contextId == null || contextId.isEmpty()) {
            return null;
        }

        String[] parts = cacheKey.split(":", -1);
        if (parts.length < 6 || !"ctx".equals(parts[0]) || !"session".equals(parts[1])) {
            return null;
        }
        // session ids may contain colons themselves
        String sessionId = String.join(":", Arrays.asList(parts).subList(5, parts.length));
        if (sessionId.isEmpty()) {
            return null;
        }

        return SessionCacheRow.builder()
                .cacheKey(cacheKey)
                .contextId(contextId)
                .updatedAtUnix(fields.size() > 2 ? parseLeadingInteger(fields.get(2)) : 0)
                .source(SessionSource.fromKeySegment(parts[2]))
                .host(parts[3])
                .engineerId(parts[4])
                .sessionId(sessionId)
                .build();
    }

    static long parseLeadingInteger(String value) {
        if (value == null) {
            return 0;
        }
        Matcher matcher = LEADING_INTEGER.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            log.debug("Ignoring out of range update time {}", value);
            return 0;
        }
    }
}
