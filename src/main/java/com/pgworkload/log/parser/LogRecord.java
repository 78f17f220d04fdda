package com.pgworkload.log.parser;

import java.time.Instant;
import java.util.Objects;

/**
 * One server log entry as handed over by a reader. Only the columns the
 * workload model needs are kept.
 */
public final class LogRecord {

    private final Instant logTime;
    private final Instant sessionStartTime;
    private final String commandTag;
    private final String message;
    private final String detail;
    private final String source;
    private final long ordinal;

    public LogRecord(Instant logTime, Instant sessionStartTime, String commandTag, String message, String detail) {
        this(logTime, sessionStartTime, commandTag, message, detail, null, 0);
    }

    public LogRecord(Instant logTime, Instant sessionStartTime, String commandTag, String message, String detail,
            String source, long ordinal) {
        this.logTime = Objects.requireNonNull(logTime, "logTime");
        this.sessionStartTime = sessionStartTime;
        this.commandTag = commandTag;
        this.message = message == null ? "" : message;
        this.detail = detail;
        this.source = source;
        this.ordinal = ordinal;
    }

    public Instant getLogTime() {
        return logTime;
    }

    public Instant getSessionStartTime() {
        return sessionStartTime;
    }

    public String getCommandTag() {
        return commandTag;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the detail column, or null when the entry has none
     */
    public String getDetail() {
        return detail;
    }

    public String getSource() {
        return source;
    }

    public long getOrdinal() {
        return ordinal;
    }

    /**
     * Short location used in error reports, e.g. {@code postgresql.csv:42}.
     */
    public String describe() {
        return (source != null ? source : "record") + ":" + ordinal;
    }

    @Override
    public String toString() {
        return "LogRecord[" + describe() + " " + logTime + " " + commandTag + "]";
    }
}
