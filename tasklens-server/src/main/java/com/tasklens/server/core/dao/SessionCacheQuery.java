package com.tasklens.server.core.dao;

import java.util.List;

/**
 * Read-only access to the local session cache store.
 */
public interface SessionCacheQuery {

    /**
     * Runs a SQL statement and returns every result row as its fields in column order.
     *
     * @throws CacheQueryException when the store cannot be queried
     */
    List<List<String>> queryRows(String sql);
}
