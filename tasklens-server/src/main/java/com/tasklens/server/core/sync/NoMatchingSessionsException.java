package com.tasklens.server.core.sync;

public class NoMatchingSessionsException extends SyncException {

    public NoMatchingSessionsException(String message) {
        super(message);
    }
}
