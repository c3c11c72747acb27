package com.tasklens.server.core.sync;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Contents of {@code index.json}, written once per sync run.
 */
@Value
@Builder
@JsonPropertyOrder({"dumpedAt", "sourceFilter", "engineerIdFilter", "hostFilter",
        "totalSessions", "totalUserMessages", "failedSessions", "sessions"})
public class SessionIndex {
    String dumpedAt;
    String sourceFilter;
    String engineerIdFilter;
    String hostFilter;
    int totalSessions;
    int totalUserMessages;
    int failedSessions;
    List<Entry> sessions;

    @Value
    @Builder
    @JsonPropertyOrder({"source", "host", "engineerId", "sessionId", "contextId",
            "updatedAt", "userMessages", "file", "rawFile"})
    public static class Entry {
        String source;
        String host;
        String engineerId;
        String sessionId;
        String contextId;
        String updatedAt;   // null when the cache row had no update time
        int userMessages;
        String file;
        String rawFile;
    }
}
