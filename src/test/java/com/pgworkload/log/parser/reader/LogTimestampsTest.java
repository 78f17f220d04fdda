package com.pgworkload.log.parser.reader;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DateTimeException;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class LogTimestampsTest {

    @Test
    public void testUtc() {
        assertEquals(Instant.parse("2021-12-06T16:01:40.123Z"), LogTimestamps.parse("2021-12-06 16:01:40.123 UTC"));
        assertEquals(Instant.parse("2021-12-06T16:01:40Z"), LogTimestamps.parse("2021-12-06 16:01:40 GMT"));
    }

    @Test
    public void testNumericOffsets() {
        assertEquals(Instant.parse("2021-12-06T13:01:40Z"), LogTimestamps.parse("2021-12-06 16:01:40 +03"));
        assertEquals(Instant.parse("2021-12-06T10:31:40Z"), LogTimestamps.parse("2021-12-06 16:01:40 +05:30"));
        assertEquals(Instant.parse("2021-12-06T21:01:40Z"), LogTimestamps.parse("2021-12-06 16:01:40 -05"));
    }

    @Test
    public void testShortZoneId() {
        assertEquals(Instant.parse("2021-12-06T21:01:40Z"), LogTimestamps.parse("2021-12-06 16:01:40 EST"));
    }

    @Test
    public void testRegionZoneId() {
        assertEquals(Instant.parse("2021-07-01T10:00:00Z"),
                LogTimestamps.parse("2021-07-01 12:00:00 Europe/Berlin"));
    }

    @Test
    public void testNoZoneMeansUtc() {
        assertEquals(Instant.parse("2021-12-06T16:01:40.5Z"), LogTimestamps.parse("2021-12-06 16:01:40.5"));
    }

    @Test
    public void testBlank() {
        assertNull(LogTimestamps.parse(null));
        assertNull(LogTimestamps.parse("  "));
    }

    @Test
    public void testInvalid() {
        assertThrows(DateTimeException.class, () -> LogTimestamps.parse("not-a-timestamp"));
        assertThrows(DateTimeException.class, () -> LogTimestamps.parse("2021-12-06 16:01:40 Nowhere/Land"));
    }
}
