package com.tasklens.server.core.dao;

import com.tasklens.server.core.sync.SyncException;

/**
 * The session cache query could not be run or returned an error.
 */
public class CacheQueryException extends SyncException {

    public CacheQueryException(String message) {
        super(message);
    }

    public CacheQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
