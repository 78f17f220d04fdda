package com.pgworkload.log.parser.accumulator;

import java.time.Instant;

import com.pgworkload.log.parser.ExclusionReason;
import com.pgworkload.log.parser.LogRecord;

public class ExcludedRecord {

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final ExclusionReason reason;
    private final String problem;
    private final String location;
    private final Instant logTime;
    private final String message;

    public ExcludedRecord(ExclusionReason reason, String problem, LogRecord record) {
        this.reason = reason;
        this.problem = problem;
        this.location = record.describe();
        this.logTime = record.getLogTime();
        String msg = record.getMessage();
        this.message = msg.length() > MAX_MESSAGE_LENGTH ? msg.substring(0, MAX_MESSAGE_LENGTH) + "..." : msg;
    }

    public ExclusionReason getReason() {
        return reason;
    }

    /**
     * @return the error message, or null for records that simply had no statement
     */
    public String getProblem() {
        return problem;
    }

    public String getLocation() {
        return location;
    }

    public Instant getLogTime() {
        return logTime;
    }

    public String getMessage() {
        return message;
    }

    public String toCsvString() {
        return String.format("%s,%s,%s,%s,%s", reason.getCode(), WorkloadAccumulator.escapeCsv(location), logTime,
                WorkloadAccumulator.escapeCsv(problem), WorkloadAccumulator.escapeCsv(message));
    }
}
