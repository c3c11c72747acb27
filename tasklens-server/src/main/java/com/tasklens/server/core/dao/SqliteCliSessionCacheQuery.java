package com.tasklens.server.core.dao;

import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.util.HomePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Queries the daemon's SQLite cache through the {@code sqlite3} command line tool.
 * Fields are separated with U+001F, which never appears in stored keys or ids.
 */
@Slf4j
@Component
public class SqliteCliSessionCacheQuery implements SessionCacheQuery {

    static final String FIELD_SEPARATOR = "\u001f";

    // plain trim() would also eat the separator, so only spaces, tabs and CRs are stripped
    private static final Pattern LINE_PADDING = Pattern.compile("^[ \\t\\r]+|[ \\t\\r]+$");

    private final String binary;
    private final Path dbPath;
    private final Duration timeout;

    public SqliteCliSessionCacheQuery(TaskLensProperties properties) {
        TaskLensProperties.Sync sync = properties.getSync();
        this.binary = sync.getSqliteBinary();
        this.dbPath = HomePaths.resolve(sync.getDbPath());
        this.timeout = sync.getQueryTimeout();
    }

    @Override
    public List<List<String>> queryRows(String sql) {
        ProcessBuilder builder = new ProcessBuilder(binary, "-separator", FIELD_SEPARATOR, dbPath.toString(), sql);
        log.debug("Querying session cache {} with {}", dbPath, binary);

        Process process;
        try {
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new CacheQueryException("unable to start %s: %s".formatted(binary, e.getMessage()), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CacheQueryException("%s timed out after %s".formatted(binary, timeout));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CacheQueryException("interrupted while waiting for " + binary, e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String error = stderr.join().strip();
            throw new CacheQueryException("%s exited with code %d: %s"
                    .formatted(binary, exitCode, error.isEmpty() ? "unknown error" : error));
        }
        return splitRows(stdout.join());
    }

    static List<List<String>> splitRows(String output) {
        List<List<String>> rows = new ArrayList<>();
        for (String line : output.split("\n")) {
            String trimmed = LINE_PADDING.matcher(line).replaceAll("");
            if (!trimmed.isEmpty()) {
                rows.add(Arrays.asList(trimmed.split(FIELD_SEPARATOR, -1)));
            }
        }
        return rows;
    }

    private static String readStream(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
