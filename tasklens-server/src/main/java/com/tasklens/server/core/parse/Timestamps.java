package com.tasklens.server.core.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Timestamp coercion shared by the log parser and the session dumper.
 * <p>
 * Numbers above 10^12 are already epoch millis, smaller numbers are epoch seconds. Strings are
 * parsed as numbers when numeric, otherwise as calendar date/times. Anything else is 0.
 */
public final class Timestamps {

    private static final double MILLIS_THRESHOLD = 1_000_000_000_000d;

    private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+(\\.\\d+)?");
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d.*");

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> ZonedDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
            text -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
    );

    private Timestamps() {
    }

    public static long toEpochMillis(JsonNode value) {
        if (value == null) {
            return 0;
        }
        if (value.isNumber()) {
            return fromNumber(value.asDouble());
        }
        if (value.isTextual()) {
            return fromText(value.asText());
        }
        return 0;
    }

    public static long fromNumber(double value) {
        if (!Double.isFinite(value)) {
            return 0;
        }
        return value > MILLIS_THRESHOLD ? (long) value : (long) (value * 1000);
    }

    public static long fromText(String value) {
        String text = value == null ? "" : value.trim();
        if (text.isEmpty()) {
            return 0;
        }
        if (NUMERIC.matcher(text).matches()) {
            return fromNumber(Double.parseDouble(text));
        }
        if (SPACE_SEPARATED.matcher(text).matches()) {
            text = text.replaceFirst(" ", "T");
        }
        for (Function<String, Instant> parser : TEXT_PARSERS) {
            try {
                return parser.apply(text).toEpochMilli();
            } catch (DateTimeException | ArithmeticException e) {
                // not this format, or outside the epoch-millis range
            }
        }
        return 0;
    }

    /**
     * Formats epoch millis as {@code yyyy-MM-ddTHH:mm:ss.SSSZ} in UTC.
     */
    public static String toIso(long epochMillis) {
        return ISO_MILLIS.format(Instant.ofEpochMilli(epochMillis));
    }

    public static String toIsoFromSeconds(long epochSeconds) {
        return toIso(epochSeconds * 1000);
    }
}
