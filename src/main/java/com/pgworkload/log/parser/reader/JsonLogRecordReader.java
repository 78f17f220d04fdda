package com.pgworkload.log.parser.reader;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgworkload.log.parser.LogRecord;

/**
 * Reads the server's {@code jsonlog} output, one JSON object per line.
 */
public class JsonLogRecordReader implements LogRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonLogRecordReader.class);

    private final BufferedReader in;
    private final String sourceName;
    private long lineNum = 0;
    private long readErrors = 0;

    public JsonLogRecordReader(BufferedReader in, String sourceName) {
        this.in = in;
        this.sourceName = sourceName;
    }

    @Override
    public LogRecord read() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNum++;
            if (line.trim().isEmpty()) {
                continue;
            }
            try {
                JSONObject jo = new JSONObject(line);
                Instant logTime = LogTimestamps.parse(jo.optString("timestamp", null));
                if (logTime == null) {
                    readErrors++;
                    continue;
                }
                Instant sessionStart = LogTimestamps.parse(jo.optString("session_start", null));
                return new LogRecord(logTime, sessionStart, jo.optString("ps", null), jo.optString("message", ""),
                        jo.optString("detail", null), sourceName, lineNum);
            } catch (JSONException | DateTimeException e) {
                readErrors++;
                if (readErrors <= 3) {
                    logger.warn("Skipping {}:{}: {}", sourceName, lineNum, e.getMessage());
                }
            }
        }
        return null;
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
        in.close();
    }
}
