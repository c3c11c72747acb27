package com.tasklens.server.core.remote;

import com.tasklens.server.core.sync.SyncException;
import lombok.Getter;

/**
 * The context service answered with a non-2xx status or an unusable body.
 */
@Getter
public class ContextFetchException extends SyncException {

    private final int status;

    public ContextFetchException(int status, String url, String body) {
        super("HTTP %d %s: %s".formatted(status, url, body));
        this.status = status;
    }

    public ContextFetchException(String message) {
        super(message);
        this.status = -1;
    }
}
