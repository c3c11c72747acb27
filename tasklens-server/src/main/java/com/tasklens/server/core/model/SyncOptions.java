package com.tasklens.server.core.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Parameters of a single session sync run.
 */
@Value
@Builder(toBuilder = true)
public class SyncOptions {
    Path outDir;
    String engineerId;
    String host;
    @Builder.Default
    SourceFilter source = SourceFilter.ALL;
    @Builder.Default
    int limit = 120;
    String baseUrl;
    String apiKey;
    boolean skipRaw;
    boolean dryRun;
    @Builder.Default
    int workers = 6;
}
