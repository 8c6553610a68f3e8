package com.aiops.anomaly.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Best-effort timestamp parsing into UTC instants.
 *
 * Zone-less values are read as UTC, never as the JVM's local zone. Missing or unparseable
 * values fall back to the current time.
 */
public final class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    // Epoch values above this are taken as milliseconds (~ year 5138 in seconds)
    private static final long EPOCH_MILLIS_CUTOFF = 100_000_000_000L;

    private static final DateTimeFormatter T_SEPARATED_OFFSET = dateTime("yyyy-MM-dd'T'HH:mm:ss", true);
    private static final DateTimeFormatter SPACE_SEPARATED_OFFSET = dateTime("yyyy-MM-dd HH:mm:ss", true);
    private static final DateTimeFormatter T_SEPARATED = dateTime("yyyy-MM-dd'T'HH:mm:ss", false);
    private static final DateTimeFormatter SPACE_SEPARATED = dateTime("yyyy-MM-dd HH:mm:ss", false);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            s -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant(),
            s -> OffsetDateTime.parse(s, T_SEPARATED_OFFSET).toInstant(),
            s -> OffsetDateTime.parse(s, SPACE_SEPARATED_OFFSET).toInstant(),
            s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s, T_SEPARATED).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampNormalizer() {}

    public static Instant normalize(Object value) {
        return normalize(value, Clock.systemUTC());
    }

    public static Instant normalize(Object value, Clock clock) {
        if (value == null) {
            return clock.instant();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return clock.instant();
        }
        if (value instanceof Number || text.chars().allMatch(Character::isDigit)) {
            try {
                long epoch = value instanceof Number n ? n.longValue() : Long.parseLong(text);
                return fromEpoch(epoch);
            } catch (NumberFormatException | DateTimeException e) {
                log.debug("Epoch timestamp out of range: {}", text);
                return clock.instant();
            }
        }

        for (Function<String, Instant> parser : PARSERS) {
            Optional<Instant> parsed = tryParse(parser, text);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }

        log.debug("Could not parse timestamp '{}', using current time", text);
        return clock.instant();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Date-time with an optional fraction after '.' or ',' and, when requested, a colon-less
     * offset such as +0200 (or Z).
     */
    private static DateTimeFormatter dateTime(String pattern, boolean withOffset) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .optionalStart()
                .appendLiteral('.')
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
                .optionalEnd()
                .optionalStart()
                .appendLiteral(',')
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
                .optionalEnd();
        if (withOffset) {
            builder.appendOffset("+HHMM", "Z");
        }
        return builder.toFormatter();
    }

    private static Instant fromEpoch(long epoch) {
        return Math.abs(epoch) >= EPOCH_MILLIS_CUTOFF
                ? Instant.ofEpochMilli(epoch)
                : Instant.ofEpochSecond(epoch);
    }
}
