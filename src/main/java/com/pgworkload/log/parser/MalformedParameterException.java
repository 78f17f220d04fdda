package com.pgworkload.log.parser;

/**
 * The detail column announced bind parameters but did not follow the
 * {@code parameters: $n = value, ...} format.
 */
public class MalformedParameterException extends WorkloadParseException {

    private static final long serialVersionUID = 1L;

    private final String pair;

    public MalformedParameterException(String pair, String problem) {
        super(problem + ": '" + pair + "'");
        this.pair = pair;
    }

    public MalformedParameterException(String pair, String problem, LogRecord record) {
        super(problem + ": '" + pair + "' in " + record.describe());
        this.pair = pair;
    }

    public String getPair() {
        return pair;
    }

    @Override
    public ExclusionReason getReason() {
        return ExclusionReason.MALFORMED_PARAMETERS;
    }
}
