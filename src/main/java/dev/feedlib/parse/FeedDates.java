package dev.feedlib.parse;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parsing of the date formats found in feeds. Unparseable values become null.
 */
final class FeedDates {

    private static final Logger log = LoggerFactory.getLogger(FeedDates.class);

    private static final List<Function<String, Instant>> FORMATS = List.of(
            value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                    .toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                    .atStartOfDay()
                    .toInstant(ZoneOffset.UTC),
            value -> OffsetDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

    private FeedDates() {
        // utility class
    }

    /**
     * Parses ISO-8601 (with or without offset, or a bare date) and RFC 1123 timestamps.
     * Values without an offset are taken as UTC.
     *
     * @param text raw date text
     * @return the instant, or null if absent or unparseable
     */
    static @Nullable Instant parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        for (Function<String, Instant> format : FORMATS) {
            try {
                return format.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("{} does not match: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable date, dropping: {}", value);
        return null;
    }
}
