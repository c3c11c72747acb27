package com.tasklens.server.core.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class DumpResult {
    SessionSource source;
    String host;
    String engineerId;
    String sessionId;
    String contextId;
    long updatedAtUnix;
    int userMessages;
    Path file;
    Path rawFile;   // null when raw output is disabled
}
