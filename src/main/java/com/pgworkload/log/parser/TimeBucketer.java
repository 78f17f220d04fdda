package com.pgworkload.log.parser;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rounds log timestamps to the nearest multiple of a fixed granularity,
 * counted from the epoch. Ties go to the even multiple, so 12:00:00.500
 * becomes 12:00:00 and 12:00:01.500 becomes 12:00:02 at one-second
 * granularity.
 */
public class TimeBucketer {

    public static final Duration DEFAULT_GRANULARITY = Duration.ofSeconds(1);

    private static final Pattern SHORTHAND = Pattern.compile("(\\d+)\\s*(ns|us|ms|s|m|h|d)");
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Duration granularity;
    private final long granularityNanos;

    public TimeBucketer() {
        this(DEFAULT_GRANULARITY);
    }

    public TimeBucketer(Duration granularity) {
        if (granularity.isZero() || granularity.isNegative()) {
            throw new IllegalArgumentException("Bucket granularity must be positive: " + granularity);
        }
        this.granularity = granularity;
        this.granularityNanos = granularity.toNanos();
    }

    public Instant bucket(Instant time) {
        long nanos = Math.addExact(Math.multiplyExact(time.getEpochSecond(), NANOS_PER_SECOND), time.getNano());
        long quotient = Math.floorDiv(nanos, granularityNanos);
        long twiceRemainder = 2 * Math.floorMod(nanos, granularityNanos);
        if (twiceRemainder > granularityNanos || (twiceRemainder == granularityNanos && (quotient & 1) == 1)) {
            quotient++;
        }
        return Instant.ofEpochSecond(0, quotient * granularityNanos);
    }

    public Duration getGranularity() {
        return granularity;
    }

    /**
     * Accepts ISO-8601 durations ({@code PT1S}) and shorthands such as
     * {@code 500ms}, {@code 1s}, {@code 5m}, {@code 1h}.
     */
    public static Duration parseGranularity(String value) {
        String trimmed = value.trim();
        Matcher m = SHORTHAND.matcher(trimmed.toLowerCase());
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            switch (m.group(2)) {
            case "ns":
                return Duration.ofNanos(amount);
            case "us":
                return Duration.ofNanos(Math.multiplyExact(amount, 1000L));
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            default:
                return Duration.ofDays(amount);
            }
        }
        try {
            return Duration.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid bucket granularity: " + value, e);
        }
    }
}
