package com.pgworkload.log.parser.reader;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses timestamps as the server writes them to its logs, e.g.
 * {@code 2021-12-06 16:01:40.123 EST} or {@code 2021-12-06 16:01:40 +03}.
 * A timestamp without a zone is taken as UTC.
 */
public final class LogTimestamps {

    private static final DateTimeFormatter LOCAL = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("z", Locale.ROOT);

    private static final Pattern OFFSET = Pattern.compile("[+-]\\d{2}(:?\\d{2}(:?\\d{2})?)?");

    private LogTimestamps() {
    }

    /**
     * @return the instant, or null for a null or blank value
     * @throws DateTimeException if the value is not a log timestamp
     */
    public static Instant parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        int dateEnd = trimmed.indexOf(' ');
        int zoneStart = dateEnd == -1 ? -1 : trimmed.indexOf(' ', dateEnd + 1);
        if (zoneStart == -1) {
            return LocalDateTime.parse(trimmed, LOCAL).toInstant(ZoneOffset.UTC);
        }
        LocalDateTime local = LocalDateTime.parse(trimmed.substring(0, zoneStart), LOCAL);
        return local.atZone(resolveZone(trimmed.substring(zoneStart + 1))).toInstant();
    }

    static ZoneId resolveZone(String zone) {
        if (OFFSET.matcher(zone).matches()) {
            return ZoneOffset.of(zone);
        }
        try {
            return ZoneId.of(zone, ZoneId.SHORT_IDS);
        } catch (DateTimeException e) {
            // abbreviations such as CEST are only known as display names
            return ZoneId.from(ZONE_NAME.parse(zone));
        }
    }
}
