package com.pgworkload.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class TimeBucketerTest {

    @Test
    public void testRoundsToNearestSecond() {
        TimeBucketer bucketer = new TimeBucketer();

        assertEquals(Instant.parse("2021-12-06T16:01:40Z"), bucketer.bucket(Instant.parse("2021-12-06T16:01:40.123Z")));
        assertEquals(Instant.parse("2021-12-06T16:01:41Z"), bucketer.bucket(Instant.parse("2021-12-06T16:01:40.501Z")));
        assertEquals(Instant.parse("2021-12-06T16:01:40Z"), bucketer.bucket(Instant.parse("2021-12-06T16:01:40Z")));
    }

    @Test
    public void testTiesGoToEven() {
        TimeBucketer bucketer = new TimeBucketer();

        assertEquals(Instant.parse("2021-12-06T16:01:40Z"), bucketer.bucket(Instant.parse("2021-12-06T16:01:40.500Z")));
        assertEquals(Instant.parse("2021-12-06T16:01:42Z"), bucketer.bucket(Instant.parse("2021-12-06T16:01:41.500Z")));
    }

    @Test
    public void testCoarserGranularity() {
        TimeBucketer bucketer = new TimeBucketer(Duration.ofMinutes(5));

        assertEquals(Instant.parse("2021-12-06T16:00:00Z"), bucketer.bucket(Instant.parse("2021-12-06T16:02:00Z")));
        assertEquals(Instant.parse("2021-12-06T16:05:00Z"), bucketer.bucket(Instant.parse("2021-12-06T16:03:00Z")));
    }

    @Test
    public void testBeforeEpoch() {
        TimeBucketer bucketer = new TimeBucketer();

        assertEquals(Instant.parse("1969-12-31T23:59:59Z"), bucketer.bucket(Instant.parse("1969-12-31T23:59:58.800Z")));
    }

    @Test
    public void testRejectsNonPositiveGranularity() {
        assertThrows(IllegalArgumentException.class, () -> new TimeBucketer(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new TimeBucketer(Duration.ofSeconds(-1)));
    }

    @Test
    public void testParseGranularity() {
        assertEquals(Duration.ofSeconds(1), TimeBucketer.parseGranularity("1s"));
        assertEquals(Duration.ofMillis(500), TimeBucketer.parseGranularity("500ms"));
        assertEquals(Duration.ofMinutes(5), TimeBucketer.parseGranularity("5m"));
        assertEquals(Duration.ofHours(1), TimeBucketer.parseGranularity("1h"));
        assertEquals(Duration.ofSeconds(10), TimeBucketer.parseGranularity("PT10S"));
        assertThrows(IllegalArgumentException.class, () -> TimeBucketer.parseGranularity("soon"));
    }
}
