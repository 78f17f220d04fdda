package com.pgworkload.log.parser.reader;

import java.io.Closeable;
import java.io.IOException;

import com.pgworkload.log.parser.LogRecord;

/**
 * Source of log records. Rows that cannot be turned into a record are
 * skipped and counted.
 */
public interface LogRecordReader extends Closeable {

    /**
     * @return the next record, or null at the end of the input
     */
    LogRecord read() throws IOException;

    long getReadErrors();

    String getSourceName();
}
