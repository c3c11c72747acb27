package com.tasklens.server.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklens.server.core.model.DumpResult;
import com.tasklens.server.core.model.SyncOptions;
import com.tasklens.server.core.parse.Timestamps;
import com.tasklens.server.core.util.IndentedJsonPrinter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class SessionIndexWriter {

    static final String INDEX_FILE = "index.json";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Writes {@code index.json} into the out directory. Sessions are listed in the order given.
     *
     * @return path of the written index
     */
    public Path write(SyncOptions options, List<DumpResult> results, int failedSessions) {
        Path outDir = options.getOutDir();
        SessionIndex index = SessionIndex.builder()
                .dumpedAt(Timestamps.toIso(clock.millis()))
                .sourceFilter(options.getSource().wireName())
                .engineerIdFilter(blankToNull(options.getEngineerId()))
                .hostFilter(blankToNull(options.getHost()))
                .totalSessions(results.size())
                .totalUserMessages(results.stream().mapToInt(DumpResult::getUserMessages).sum())
                .failedSessions(failedSessions)
                .sessions(results.stream().map(result -> toEntry(outDir, result)).collect(Collectors.toList()))
                .build();

        Path indexPath = outDir.resolve(INDEX_FILE);
        try {
            String json = objectMapper.writer(new IndentedJsonPrinter()).writeValueAsString(index);
            Files.writeString(indexPath, json + "\n", StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new SyncException("Unable to serialize session index", e);
        } catch (IOException e) {
            throw new SyncException("Unable to write " + indexPath, e);
        }
        return indexPath;
    }

    private static SessionIndex.Entry toEntry(Path outDir, DumpResult result) {
        return SessionIndex.Entry.builder()
                .source(result.getSource().wireName())
                .host(result.getHost())
                .engineerId(result.getEngineerId())
                .sessionId(result.getSessionId())
                .contextId(result.getContextId())
                .updatedAt(result.getUpdatedAtUnix() != 0 ? Timestamps.toIsoFromSeconds(result.getUpdatedAtUnix()) : null)
                .userMessages(result.getUserMessages())
                .file(relative(outDir, result.getFile()))
                .rawFile(result.getRawFile() == null ? null : relative(outDir, result.getRawFile()))
                .build();
    }

    // forward slashes regardless of platform
    private static String relative(Path outDir, Path file) {
        return outDir.relativize(file).toString().replace('\\', '/');
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
