package com.tasklens.server.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklens.server.core.model.DumpResult;
import com.tasklens.server.core.model.SessionCacheRow;
import com.tasklens.server.core.model.SessionSource;
import com.tasklens.server.core.model.SyncOptions;
import com.tasklens.server.core.remote.ContextClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionDumperTest {

    @TempDir
    Path outDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ContextClient contextClient = mock(ContextClient.class);
    private final SessionDumper dumper = new SessionDumper(contextClient, objectMapper,
            Clock.fixed(Instant.parse("2024-05-02T00:00:00Z"), ZoneOffset.UTC));

    private final SessionCacheRow row = SessionCacheRow.builder()
            .cacheKey("ctx:session:codex:hostA:eng1:sess/1")
            .contextId("ctx-1")
            .updatedAtUnix(1714557600)
            .source(SessionSource.CODEX)
            .host("hostA")
            .engineerId("eng1")
            .sessionId("sess/1")
            .build();

    private JsonNode detail;

    @BeforeEach
    void loadFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/context-detail.json")) {
            detail = objectMapper.readTree(in);
        }
        Files.createDirectories(outDir.resolve(SessionDumper.RAW_DIR));
    }

    private SyncOptions options(boolean skipRaw) {
        return SyncOptions.builder()
                .outDir(outDir)
                .baseUrl("https://api.example.test")
                .skipRaw(skipRaw)
                .build();
    }

    @Test
    void writesOneLinePerUserMessage() throws IOException {
        when(contextClient.fetch("https://api.example.test", "key-1", "ctx-1")).thenReturn(Mono.just(detail));

        DumpResult result = dumper.dump(row, options(false), "key-1").block(Duration.ofSeconds(5));

        assertEquals(3, result.getUserMessages());
        assertEquals(outDir.resolve("codex-sess_1.jsonl"), result.getFile());
        assertEquals(outDir.resolve("_raw/codex-sess_1.json"), result.getRawFile());

        String content = Files.readString(result.getFile());
        assertTrue(content.endsWith("\n"));
        List<String> lines = content.lines().toList();
        assertEquals(3, lines.size());
        assertEquals("{\"type\":\"user\",\"source\":\"codex\",\"timestamp\":\"2024-05-01T10:05:00.000Z\","
                + "\"sessionId\":\"sess/1\",\"contextId\":\"ctx-1\",\"message\":{\"content\":\"deploy the service\"}}",
                lines.get(0));

        JsonNode second = objectMapper.readTree(lines.get(1));
        assertEquals("check the logs", second.at("/message/content").asText());
        assertEquals("2024-05-01T10:10:00.000Z", second.get("timestamp").asText());

        JsonNode third = objectMapper.readTree(lines.get(2));
        assertEquals("rollback please", third.at("/message/content").asText());
        assertEquals("2024-05-01T10:00:00.000Z", third.get("timestamp").asText());
    }

    @Test
    void rawFileWrapsTheUntouchedPayload() throws IOException {
        DumpResult result = dumper.write(row, detail, options(false));

        String raw = Files.readString(result.getRawFile());
        assertTrue(raw.startsWith("{\n  \"pulledAt\": \"2024-05-02T00:00:00.000Z\",\n  \"cache\": {\n"), raw);
        assertTrue(raw.endsWith("}\n"));

        JsonNode parsed = objectMapper.readTree(raw);
        assertEquals("ctx:session:codex:hostA:eng1:sess/1", parsed.at("/cache/cacheKey").asText());
        assertEquals(1714557600L, parsed.at("/cache/updatedAtUnix").asLong());
        assertEquals(detail, parsed.get("detail"));
    }

    @Test
    void skipRawWritesOnlyTheSessionFile() throws IOException {
        DumpResult result = dumper.write(row, detail, options(true));

        assertNull(result.getRawFile());
        assertFalse(Files.exists(outDir.resolve("_raw/codex-sess_1.json")));
        assertEquals(3, Files.readString(result.getFile()).lines().count());
    }

    @Test
    void sessionWithoutUserMessagesGetsAnEmptyFile() throws IOException {
        JsonNode empty = objectMapper.readTree("{\"data\":[{\"role\":\"assistant\",\"content\":\"hello\"}]}");

        DumpResult result = dumper.write(row, empty, options(true));

        assertEquals(0, result.getUserMessages());
        assertEquals("", Files.readString(result.getFile()));
    }

    @Test
    void fetchFailurePropagates() {
        when(contextClient.fetch("https://api.example.test", "key-1", "ctx-1"))
                .thenReturn(Mono.error(new SyncException("HTTP 500")));

        assertThrows(SyncException.class, () -> dumper.dump(row, options(false), "key-1").block(Duration.ofSeconds(5)));
    }

    @Test
    void sanitizesFileNames() {
        assertEquals("claude-a_b_c.d-e", SessionDumper.sanitizeFileName("claude-a:/ b::c.d-e"));
        assertEquals("codex-_x_", SessionDumper.sanitizeFileName("codex-\u00e9x\u00e9\u00e9"));
    }
}
