package org.salesintel.service.transform;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Normalizes the date shapes external systems send. Calendar dates come back as {@code yyyy-MM-dd},
 * everything carrying a time of day as a UTC ISO-8601 instant.
 */
public final class DateValueParser {

    private static final long MILLIS_THRESHOLD = 100_000_000_000L; // ~1973 in ms
    // Odoo serializes datetimes without a zone, always in UTC
    private static final DateTimeFormatter ODOO_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, String>> TEXT_PARSERS = List.of(
            text -> LocalDate.parse(text).toString(),
            text -> LocalDateTime.parse(text, ODOO_DATETIME).toInstant(ZoneOffset.UTC).toString(),
            text -> OffsetDateTime.parse(text).toInstant().toString(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toString()
    );

    private DateValueParser() {
    }

    public static Optional<String> normalize(Object value) {
        if (value == null || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.toString());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.toString());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toInstant().toString());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toInstant().toString());
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toInstant(ZoneOffset.UTC).toString());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().toString());
        }
        if (value instanceof Number number) {
            return fromEpochMillis(number.longValue());
        }
        if (value instanceof CharSequence text) {
            return parseText(text.toString().trim());
        }
        return Optional.empty();
    }

    private static Optional<String> parseText(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.matches("^-?\\d{10,}$")) {
            try {
                return fromEpochMillis(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        for (Function<String, String> parser : TEXT_PARSERS) {
            Optional<String> parsed = attempt(parser, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> attempt(Function<String, String> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> fromEpochMillis(long millis) {
        if (Math.abs(millis) < MILLIS_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli(millis).toString());
    }
}
