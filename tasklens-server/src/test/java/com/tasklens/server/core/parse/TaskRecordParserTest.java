package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklens.server.core.model.LogSource;
import com.tasklens.server.core.model.TaskRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskRecordParserTest {

    private static final Path PLAIN_FILE = Path.of("/team/alice/log/a.jsonl");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TaskRecordParser parser = new TaskRecordParser();

    private List<TaskRecord> parse(Path file, String json) throws Exception {
        return parser.parse(file, 7, "alice", objectMapper.readTree(json));
    }

    @Test
    void codexLine() throws Exception {
        List<TaskRecord> records = parse(PLAIN_FILE,
                "{\"session_id\":\"s1\",\"ts\":1700000000,\"text\":\"fix   the\\nlogin bug\"}");

        assertEquals(1, records.size());
        TaskRecord record = records.get(0);
        assertEquals("alice", record.getEngineer());
        assertEquals(LogSource.CODEX, record.getSource());
        assertEquals("fix the login bug", record.getText());
        assertEquals(1_700_000_000_000L, record.getTimestampMs());
        assertEquals("s1", record.getSessionId());
        assertEquals(PLAIN_FILE.toString(), record.getFile());
        assertEquals(7, record.getLine());
    }

    @Test
    void claudeLine() throws Exception {
        TaskRecord record = parse(PLAIN_FILE,
                "{\"display\":\"refactor the parser\",\"timestamp\":1700000000000,\"project\":\"/work/app\"}").get(0);

        assertEquals(LogSource.CLAUDE, record.getSource());
        assertEquals("/work/app", record.getProject());
        assertNull(record.getSessionId());
    }

    @Test
    void locationOverridesLayoutDefault() throws Exception {
        Path codexHome = Path.of("/team/alice/log/.codex/history.jsonl");
        TaskRecord record = parse(codexHome,
                "{\"display\":\"refactor the parser\",\"timestamp\":\"2024-01-01\"}").get(0);

        assertEquals(LogSource.CODEX, record.getSource());
    }

    @Test
    void userTraceSourceComesFromClassifier() throws Exception {
        String trace = "{\"type\":\"user\",\"message\":{\"content\":\"deploy the payments service\"}}";

        assertEquals(LogSource.UNKNOWN, parse(PLAIN_FILE, trace).get(0).getSource());
        assertEquals(LogSource.CLAUDE,
                parse(Path.of("/team/bob/log/.claude/projects/x.jsonl"), trace).get(0).getSource());
        assertEquals(LogSource.CODEX, parse(PLAIN_FILE,
                "{\"type\":\"user\",\"session_id\":\"s2\",\"message\":{\"content\":\"deploy it\"}}").get(0).getSource());
    }

    @Test
    void noiseIsNeverMaterialized() throws Exception {
        assertTrue(parse(PLAIN_FILE, "{\"type\":\"user\",\"message\":{\"content\":\"/clear\"}}").isEmpty());
        assertTrue(parse(PLAIN_FILE, "{\"type\":\"user\",\"message\":{\"content\":\"  \\n \"}}").isEmpty());
        assertTrue(parse(PLAIN_FILE, "{\"text\":\"ok\",\"ts\":1}").isEmpty());
        assertTrue(parse(PLAIN_FILE, "{\"type\":\"summary\",\"summary\":\"long enough text\"}").isEmpty());
    }
}
