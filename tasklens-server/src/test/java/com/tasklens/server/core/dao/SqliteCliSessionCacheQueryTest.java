package com.tasklens.server.core.dao;

import com.tasklens.server.config.TaskLensProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs against small shell scripts standing in for the sqlite3 binary.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SqliteCliSessionCacheQueryTest {

    @TempDir
    Path dir;

    @Test
    void splitsRowsOnTheUnitSeparator() throws IOException {
        Path fake = script("fake-sqlite3", String.join("\n",
                "#!/bin/sh",
                "printf 'ctx:session:codex:hostA:eng1:sess1\\037ctx-1\\037200\\n'",
                "printf '\\n'",
                "printf '%s\\037ctx-2\\037100\\n' \"$3\""));

        List<List<String>> rows = query(fake, Duration.ofSeconds(10))
                .queryRows("SELECT 1;");

        assertEquals(2, rows.size());
        assertEquals(List.of("ctx:session:codex:hostA:eng1:sess1", "ctx-1", "200"), rows.get(0));
        // third argument is the database path
        assertEquals(dir.resolve("daemon.db").toString(), rows.get(1).get(0));
    }

    @Test
    void nonZeroExitFails() throws IOException {
        Path fake = script("failing-sqlite3", "#!/bin/sh\necho 'no such table: context_cache' >&2\nexit 1\n");

        CacheQueryException error = assertThrows(CacheQueryException.class,
                () -> query(fake, Duration.ofSeconds(10)).queryRows("SELECT 1;"));

        assertTrue(error.getMessage().contains("exited with code 1"), error.getMessage());
        assertTrue(error.getMessage().contains("no such table"), error.getMessage());
    }

    @Test
    void hungProcessTimesOut() throws IOException {
        Path fake = script("slow-sqlite3", "#!/bin/sh\nexec sleep 30\n");

        CacheQueryException error = assertThrows(CacheQueryException.class,
                () -> query(fake, Duration.ofMillis(200)).queryRows("SELECT 1;"));

        assertTrue(error.getMessage().contains("timed out"), error.getMessage());
    }

    @Test
    void missingBinaryFails() {
        assertThrows(CacheQueryException.class,
                () -> query(dir.resolve("not-installed"), Duration.ofSeconds(1)).queryRows("SELECT 1;"));
    }

    @Test
    void keepsTrailingEmptyFields() {
        assertEquals(List.of(List.of("a", "b", "")),
                SqliteCliSessionCacheQuery.splitRows("a\u001fb\u001f\r\n\n"));
    }

    private SqliteCliSessionCacheQuery query(Path binary, Duration timeout) {
        TaskLensProperties properties = new TaskLensProperties();
        properties.getSync().setSqliteBinary(binary.toString());
        properties.getSync().setDbPath(dir.resolve("daemon.db").toString());
        properties.getSync().setQueryTimeout(timeout);
        return new SqliteCliSessionCacheQuery(properties);
    }

    private Path script(String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, body);
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }
}
