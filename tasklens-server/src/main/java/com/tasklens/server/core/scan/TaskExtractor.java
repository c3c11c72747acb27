package com.tasklens.server.core.scan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.tasklens.server.core.model.TaskRecord;
import com.tasklens.server.core.parse.TaskRecordParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one .jsonl file and returns its task records in file order.
 * Lines that are not JSON objects are skipped; an unreadable file yields nothing.
 */
@Slf4j
@Component
public class TaskExtractor {

    // a line holding anything after its JSON value is malformed
    private final ObjectReader lineReader;
    private final TaskRecordParser parser;

    public TaskExtractor(ObjectMapper objectMapper, TaskRecordParser parser) {
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.parser = parser;
    }

    public List<TaskRecord> extract(Path file, String engineer) {
        String raw;
        try {
            raw = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Skipping unreadable log file {}: {}", file, e.getMessage());
            return List.of();
        }

        List<TaskRecord> records = new ArrayList<>();
        String[] lines = raw.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node = readLine(line);
            if (node == null || !node.isObject()) {
                continue;
            }
            records.addAll(parser.parse(file, i + 1, engineer, node));
        }
        return records;
    }

    private JsonNode readLine(String line) {
        try {
            return lineReader.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
