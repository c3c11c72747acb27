package com.tasklens.server.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Pointer row from the session cache, decoded from a key of the form
 * {@code ctx:session:<source>:<host>:<engineerId>:<sessionId...>}.
 */
@Value
@Builder
public class SessionCacheRow {
    String cacheKey;
    String contextId;
    long updatedAtUnix;
    SessionSource source;
    String host;
    String engineerId;
    String sessionId;

    /**
     * Identity of the session this row points at; rows sharing it are duplicates of each other.
     */
    public String sessionKey() {
        return String.join(":", source.wireName(), host, engineerId, sessionId);
    }
}
