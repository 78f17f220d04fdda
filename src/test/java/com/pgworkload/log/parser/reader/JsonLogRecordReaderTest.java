package com.pgworkload.log.parser.reader;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pgworkload.log.parser.LogRecord;

public class JsonLogRecordReaderTest {

    private List<LogRecord> readAll(LogRecordReader reader) throws Exception {
        List<LogRecord> records = new ArrayList<>();
        LogRecord record;
        while ((record = reader.read()) != null) {
            records.add(record);
        }
        return records;
    }

    @Test
    public void testReadSampleFile() throws Exception {
        File file = new File(getClass().getResource("/postgresql-sample.json").toURI());

        try (LogRecordReader reader = LogFormat.fromFileName(file.getName()).open(file)) {
            List<LogRecord> records = readAll(reader);

            assertEquals(3, records.size());
            assertEquals(1, reader.getReadErrors());

            LogRecord first = records.get(0);
            assertEquals(Instant.parse("2022-03-04T11:08:00.123Z"), first.getLogTime());
            assertEquals(Instant.parse("2022-03-04T11:07:12Z"), first.getSessionStartTime());
            assertEquals("SELECT", first.getCommandTag());
            assertEquals("execute <unnamed>: SELECT name FROM users WHERE id = $1", first.getMessage());
            assertEquals("parameters: $1 = '42'", first.getDetail());

            assertNull(records.get(1).getDetail());

            LogRecord delete = records.get(2);
            assertEquals("statement: DELETE FROM users WHERE id = 7", delete.getMessage());
            assertEquals(5, delete.getOrdinal());
        }
    }

    @Test
    public void testMissingTimestampIsReadError() throws Exception {
        String json = "{\"message\":\"statement: SELECT 1\"}\n"
                + "{\"timestamp\":\"2022-03-04 11:08:00 UTC\",\"message\":\"statement: SELECT 2\"}\n";

        try (JsonLogRecordReader reader = new JsonLogRecordReader(new BufferedReader(new StringReader(json)), "inline")) {
            List<LogRecord> records = readAll(reader);
            assertEquals(1, records.size());
            assertEquals("statement: SELECT 2", records.get(0).getMessage());
            assertNull(records.get(0).getCommandTag());
            assertEquals(1, reader.getReadErrors());
        }
    }

    @Test
    public void testBadTimestampIsReadError() throws Exception {
        String json = "{\"timestamp\":\"yesterday\",\"message\":\"statement: SELECT 1\"}\n";

        try (JsonLogRecordReader reader = new JsonLogRecordReader(new BufferedReader(new StringReader(json)), "inline")) {
            assertNull(reader.read());
            assertEquals(1, reader.getReadErrors());
        }
    }
}
