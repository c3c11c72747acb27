package com.tasklens.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings under {@code tasklens.*}.
 */
@Data
@ConfigurationProperties(prefix = "tasklens")
public class TaskLensProperties {

    private Query query = new Query();
    private Sync sync = new Sync();

    @Data
    public static class Query {
        /** Default team root when a request does not name one. */
        private String teamRoot = "~/team";
        /** Threads used to read log files concurrently. */
        private int parallelism = 8;
        /** How deep below an engineer's log directory .jsonl files are looked for. */
        private int maxWalkDepth = 16;
    }

    @Data
    public static class Sync {
        private String dbPath = "~/.ultracontext/daemon.db";
        private String sqliteBinary = "sqlite3";
        private Duration queryTimeout = Duration.ofSeconds(60);

        private String outDir = "teams/demo/fabio/log";
        private String baseUrl = "https://api.ultracontext.ai";

        /** Explicit key. The environment variable below takes precedence over it. */
        private String apiKey;
        private String apiKeyEnv = "ULTRACONTEXT_API_KEY";
        private String configFile = "~/.ultracontext/config.toml";

        private String engineerId;
        private String host;
        private String source = "all";
        private int limit = 120;
        private boolean skipRaw;
        private boolean dryRun;

        private int workers = 6;
        private Duration fetchTimeout = Duration.ofSeconds(60);
        /** Largest context payload buffered in memory. */
        private DataSize maxPayloadSize = DataSize.ofMegabytes(64);
        private int historySize = 50;

        private Auto auto = new Auto();
    }

    @Data
    public static class Auto {
        private boolean enabled;
        private Duration interval = Duration.ofMinutes(10);
    }
}
