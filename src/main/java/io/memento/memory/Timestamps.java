package io.memento.memory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Function;

/**
 * Reads and writes the timestamp text stored in workspace databases.
 *
 * <p>Rows carry either ISO-8601 instants or SQLite {@code datetime('now')} text
 * ({@code yyyy-MM-dd HH:mm:ss}, UTC). Both are accepted; writes use the SQLite form.</p>
 */
public final class Timestamps {

    private static final DateTimeFormatter SQLITE_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            v -> LocalDateTime.parse(v, SQLITE_FORMAT).toInstant(ZoneOffset.UTC),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
            v -> LocalDate.parse(v).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private Timestamps() {
    }

    /**
     * Parses stored timestamp text. Returns null for null, blank or unparsable input.
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        for (Function<String, Instant> parser : PARSERS) {
            Instant parsed = attempt(parser, value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Formats an instant the way SQLite's {@code datetime('now')} does, truncated to seconds.
     */
    public static String format(Instant instant) {
        if (instant == null) {
            return null;
        }
        return WRITE_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    }

    private static Instant attempt(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
