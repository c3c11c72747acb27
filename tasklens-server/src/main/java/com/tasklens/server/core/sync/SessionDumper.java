package com.tasklens.server.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tasklens.server.core.model.DumpResult;
import com.tasklens.server.core.model.SessionCacheRow;
import com.tasklens.server.core.model.SyncOptions;
import com.tasklens.server.core.parse.TextNormalizer;
import com.tasklens.server.core.parse.Timestamps;
import com.tasklens.server.core.remote.ContextClient;
import com.tasklens.server.core.util.IndentedJsonPrinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one session and writes its user messages as {@code <source>-<sessionId>.jsonl},
 * plus the untouched payload under {@code _raw/} unless raw output is off.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionDumper {

    static final String RAW_DIR = "_raw";

    private final ContextClient contextClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Mono<DumpResult> dump(SessionCacheRow row, SyncOptions options, String apiKey) {
        return contextClient.fetch(options.getBaseUrl(), apiKey, row.getContextId())
                .publishOn(Schedulers.boundedElastic())
                .map(detail -> write(row, detail, options));
    }

    DumpResult write(SessionCacheRow row, JsonNode detail, SyncOptions options) {
        JsonNode data = detail.get("data");
        String createdAt = Timestamps.toIso(Timestamps.toEpochMillis(detail.get("created_at")));

        List<String> lines = new ArrayList<>();
        if (data != null && data.isArray()) {
            for (JsonNode message : data) {
                if (!UserMessageExtractor.isUserMessage(message)) {
                    continue;
                }
                String text = TextNormalizer.collapse(UserMessageExtractor.extractText(message));
                if (text.isEmpty()) {
                    continue;
                }
                lines.add(toJson(userLine(row, text, UserMessageExtractor.extractTimestamp(message, createdAt))));
            }
        }

        String baseName = sanitizeFileName(row.getSource().wireName() + "-" + row.getSessionId());
        Path outFile = options.getOutDir().resolve(baseName + ".jsonl");
        writeFile(outFile, lines.isEmpty() ? "" : String.join("\n", lines) + "\n");

        Path rawFile = null;
        if (!options.isSkipRaw()) {
            rawFile = options.getOutDir().resolve(RAW_DIR).resolve(baseName + ".json");
            writeFile(rawFile, toPrettyJson(rawPayload(row, detail)) + "\n");
        }
        log.debug("Dumped {} user messages of session {} to {}", lines.size(), row.getSessionId(), outFile);

        return DumpResult.builder()
                .source(row.getSource())
                .host(row.getHost())
                .engineerId(row.getEngineerId())
                .sessionId(row.getSessionId())
                .contextId(row.getContextId())
                .updatedAtUnix(row.getUpdatedAtUnix())
                .userMessages(lines.size())
                .file(outFile)
                .rawFile(rawFile)
                .build();
    }

    /**
     * Replaces each run of characters outside {@code [A-Za-z0-9._-]} with a single underscore.
     */
    public static String sanitizeFileName(String value) {
        return value.replaceAll("[^a-zA-Z0-9._-]+", "_");
    }

    private ObjectNode userLine(SessionCacheRow row, String text, String timestamp) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put("type", "user");
        line.put("source", row.getSource().wireName());
        line.put("timestamp", timestamp);
        line.put("sessionId", row.getSessionId());
        line.put("contextId", row.getContextId());
        line.putObject("message").put("content", text);
        return line;
    }

    private ObjectNode rawPayload(SessionCacheRow row, JsonNode detail) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("pulledAt", Timestamps.toIso(clock.millis()));
        ObjectNode cache = payload.putObject("cache");
        cache.put("cacheKey", row.getCacheKey());
        cache.put("contextId", row.getContextId());
        cache.put("source", row.getSource().wireName());
        cache.put("host", row.getHost());
        cache.put("engineerId", row.getEngineerId());
        cache.put("sessionId", row.getSessionId());
        cache.put("updatedAtUnix", row.getUpdatedAtUnix());
        payload.set("detail", detail);
        return payload;
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SyncException("Unable to serialize session line", e);
        }
    }

    private String toPrettyJson(JsonNode node) {
        try {
            return objectMapper.writer(new IndentedJsonPrinter()).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SyncException("Unable to serialize raw session payload", e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + file, e);
        }
    }
}
