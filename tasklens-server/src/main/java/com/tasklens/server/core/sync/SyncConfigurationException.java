package com.tasklens.server.core.sync;

/**
 * Missing credential or invalid sync settings. Raised before any remote call is made.
 */
public class SyncConfigurationException extends SyncException {

    public SyncConfigurationException(String message) {
        super(message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
