package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TimestampsTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void smallNumbersAreSeconds() {
        assertEquals(1_700_000_000_000L, Timestamps.toEpochMillis(NODES.numberNode(1_700_000_000)));
        assertEquals(1_500L, Timestamps.fromNumber(1.5));
    }

    @Test
    void largeNumbersAreAlreadyMillis() {
        assertEquals(1_700_000_000_123L, Timestamps.toEpochMillis(NODES.numberNode(1_700_000_000_123L)));
    }

    @Test
    void parsesCalendarStrings() {
        assertEquals(Instant.parse("2024-01-02T03:04:05Z").toEpochMilli(),
                Timestamps.fromText("2024-01-02T03:04:05Z"));
        assertEquals(Instant.parse("2024-01-02T01:04:05.500Z").toEpochMilli(),
                Timestamps.fromText("2024-01-02T03:04:05.500+02:00"));
        assertEquals(Instant.parse("2024-01-02T00:00:00Z").toEpochMilli(),
                Timestamps.fromText("2024-01-02"));
        assertEquals(Instant.parse("2024-01-02T03:04:05Z").toEpochMilli(),
                Timestamps.fromText("2024-01-02 03:04:05"));
        assertEquals(Instant.parse("1994-11-06T08:49:37Z").toEpochMilli(),
                Timestamps.fromText("Sun, 06 Nov 1994 08:49:37 GMT"));
    }

    @Test
    void numericStringsFollowTheNumberRule() {
        assertEquals(1_700_000_000_000L, Timestamps.toEpochMillis(NODES.textNode("1700000000")));
    }

    @Test
    void anythingElseIsZero() {
        assertEquals(0, Timestamps.toEpochMillis(null));
        assertEquals(0, Timestamps.toEpochMillis(BooleanNode.TRUE));
        assertEquals(0, Timestamps.toEpochMillis(NODES.objectNode()));
        assertEquals(0, Timestamps.fromText("yesterday"));
        assertEquals(0, Timestamps.fromText("   "));
    }

    @Test
    void datesBeyondTheMillisRangeAreZero() {
        assertEquals(0, Timestamps.fromText("+999999999-12-31T23:59:59Z"));
        assertEquals(0, Timestamps.toEpochMillis(NODES.textNode("-999999999-01-01T00:00:00")));
    }

    @Test
    void formatsIsoWithMillis() {
        assertEquals("1970-01-01T00:00:00.000Z", Timestamps.toIso(0));
        assertEquals("2023-11-14T22:13:20.000Z", Timestamps.toIso(1_700_000_000_000L));
        assertEquals("2023-11-14T22:13:20.000Z", Timestamps.toIsoFromSeconds(1_700_000_000L));
    }
}
