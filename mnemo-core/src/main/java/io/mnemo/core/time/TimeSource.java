package io.mnemo.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical source of "now" and of age arithmetic for the engine.
 *
 * <p>All comparisons happen on absolute {@link Instant}s, so daylight-saving transitions and
 * the offset a timestamp was written with never change the computed age.
 */
public final class TimeSource {
    private static final Logger LOG = LoggerFactory.getLogger(TimeSource.class);

    /** Stand-in for missing or unparsable timestamps; sorts before every real instant. */
    public static final Instant MAXIMALLY_STALE = Instant.EPOCH;

    private final Clock clock;

    public TimeSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static TimeSource systemUtc() {
        return new TimeSource(Clock.systemUTC());
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Parses an ISO-8601 timestamp into an absolute instant. Accepts {@code Z}, numeric offsets,
     * region ids, offset-naive date-times (read as UTC), a space instead of {@code T} between date
     * and time, and bare dates. Never throws.
     */
    public Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return MAXIMALLY_STALE;
        }
        String value = spaceSeparated(text.trim());

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException notDateTime) {
            return parseDate(value);
        }
    }

    // "2025-05-31 12:00:00" as written by SQL and Python's str(datetime)
    private static String spaceSeparated(String value) {
        if (value.length() > 10 && value.charAt(10) == ' ') {
            return value.substring(0, 10) + 'T' + value.substring(11).trim();
        }
        return value;
    }

    private Instant parseDate(String value) {
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            LOG.warn("Unparsable timestamp '{}', treating it as maximally stale: {}", value, e.getMessage());
            return MAXIMALLY_STALE;
        }
    }

    public Duration diff(Instant later, Instant earlier) {
        Instant safeLater = later == null ? MAXIMALLY_STALE : later;
        Instant safeEarlier = earlier == null ? MAXIMALLY_STALE : earlier;
        Duration delta = Duration.between(safeEarlier, safeLater);
        return delta.isNegative() ? Duration.ZERO : delta;
    }

    public Duration ageOf(Instant instant) {
        return diff(now(), instant);
    }

    public String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant == null ? MAXIMALLY_STALE : instant);
    }
}
