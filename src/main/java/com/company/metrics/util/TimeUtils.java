package com.company.metrics.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

public class TimeUtils {

    private static final List<Pattern> TIMESTAMP_PATTERNS = List.of(
            // 2025-05-23T11:48:26.341261+00:00
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d+[+-]\\d{2}:\\d{2}$"),
            // 2025-05-23T11:48:26.341267
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d+$"),
            // 2025-05-23T11:48:26
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}$"),
            // 2025-05-23T11:48
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}$"),
            // 2025-05-23T11:48:26.341261Z
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d+Z$"),
            // 2025-05-23
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$"),
            // epoch seconds: 1716464906
            Pattern.compile("^\\d{10}$"),
            // epoch millis: 1716464906341
            Pattern.compile("^\\d{13}$")
    );

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy")
    );

    private static final List<Function<String, Instant>> INSTANT_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private static final Pattern DATE_LIKE = Pattern.compile("\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}");
    private static final Pattern TIME_LIKE = Pattern.compile("\\d{1,2}:\\d{2}");

    /**
     * Heuristic check for timestamp-looking values: ISO 8601 variants, dates,
     * 10/13-digit epoch strings, a few common formats, and date-plus-time shaped text.
     */
    public static boolean isTimestampLike(Object value) {
        if (!(value instanceof String text)) {
            return false;
        }

        for (Pattern pattern : TIMESTAMP_PATTERNS) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }

        for (DateTimeFormatter format : FALLBACK_FORMATS) {
            if (parses(text, format)) {
                return true;
            }
        }

        return DATE_LIKE.matcher(text).find()
                && (text.contains("T") || TIME_LIKE.matcher(text).find());
    }

    /**
     * Converts an ISO 8601 timestamp to epoch millis. Values without an offset are read as UTC,
     * date-only values as UTC midnight.
     *
     * @return epoch millis, or null if the value is not an ISO timestamp
     */
    public static Long toEpochMillis(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        for (Function<String, Instant> parser : INSTANT_PARSERS) {
            Instant instant = tryParse(text, parser);
            if (instant != null) {
                return instant.toEpochMilli();
            }
        }
        return null;
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }

    private static Instant tryParse(String text, Function<String, Instant> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean parses(String text, DateTimeFormatter format) {
        try {
            format.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
