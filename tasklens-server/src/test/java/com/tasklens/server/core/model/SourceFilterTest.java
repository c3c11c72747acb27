package com.tasklens.server.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceFilterTest {

    @Test
    void parsesNamesCaseInsensitively() {
        assertEquals(SourceFilter.ALL, SourceFilter.parse(null));
        assertEquals(SourceFilter.ALL, SourceFilter.parse("  "));
        assertEquals(SourceFilter.CODEX, SourceFilter.parse(" Codex "));
        assertEquals(SourceFilter.OPENCLAW, SourceFilter.parse("OPENCLAW"));
        assertThrows(IllegalArgumentException.class, () -> SourceFilter.parse("gemini"));
    }

    @Test
    void allMatchesUnknownSourcesToo() {
        assertTrue(SourceFilter.ALL.matches(SessionSource.UNKNOWN));
        assertTrue(SourceFilter.CLAUDE.matches(SessionSource.CLAUDE));
        assertFalse(SourceFilter.CLAUDE.matches(SessionSource.CODEX));
        assertFalse(SourceFilter.CODEX.matches(SessionSource.UNKNOWN));
    }

    @Test
    void keySegmentsMapToSessionSources() {
        assertEquals(SessionSource.CLAUDE, SessionSource.fromKeySegment("Claude"));
        assertEquals(SessionSource.UNKNOWN, SessionSource.fromKeySegment("unknown"));
        assertEquals(SessionSource.UNKNOWN, SessionSource.fromKeySegment(null));
    }
}
