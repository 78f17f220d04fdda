package com.pgworkload.log.parser.reader;

import java.io.IOException;
import java.io.Reader;
import java.time.DateTimeException;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.pgworkload.log.parser.LogRecord;

/**
 * Reads the server's {@code csvlog} output. Columns are addressed by
 * position; trailing columns added by newer server versions are ignored.
 */
public class CsvLogRecordReader implements LogRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(CsvLogRecordReader.class);

    static final int LOG_TIME = 0;
    static final int COMMAND_TAG = 7;
    static final int SESSION_START_TIME = 8;
    static final int MESSAGE = 13;
    static final int DETAIL = 14;

    private static final CsvMapper mapper = new CsvMapper();

    private final Reader in;
    private final MappingIterator<String[]> rows;
    private final String sourceName;
    private long rowNum = 0;
    private long readErrors = 0;

    public CsvLogRecordReader(Reader in, String sourceName) throws IOException {
        this.in = in;
        this.sourceName = sourceName;
        this.rows = mapper.readerFor(String[].class)
                .withFeatures(CsvParser.Feature.WRAP_AS_ARRAY, CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(in);
    }

    @Override
    public LogRecord read() throws IOException {
        while (rows.hasNextValue()) {
            String[] row = rows.nextValue();
            rowNum++;
            if (row.length <= DETAIL) {
                readErrors++;
                logger.debug("{}:{} has {} columns, expected at least {}", sourceName, rowNum, row.length,
                        DETAIL + 1);
                continue;
            }
            Instant logTime;
            Instant sessionStart;
            try {
                logTime = LogTimestamps.parse(row[LOG_TIME]);
                sessionStart = LogTimestamps.parse(row[SESSION_START_TIME]);
            } catch (DateTimeException e) {
                readErrors++;
                logger.debug("{}:{} has an unreadable timestamp: {}", sourceName, rowNum, e.getMessage());
                continue;
            }
            if (logTime == null) {
                readErrors++;
                continue;
            }
            return new LogRecord(logTime, sessionStart, emptyToNull(row[COMMAND_TAG]), row[MESSAGE],
                    emptyToNull(row[DETAIL]), sourceName, rowNum);
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public long getReadErrors() {
        return readErrors;
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public void close() throws IOException {
        rows.close();
        in.close();
    }
}
