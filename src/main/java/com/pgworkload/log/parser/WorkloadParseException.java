package com.pgworkload.log.parser;

/**
 * Base class for failures that exclude a single record from the workload
 * without stopping the run.
 */
public abstract class WorkloadParseException extends Exception {

    private static final long serialVersionUID = 1L;

    protected WorkloadParseException(String message) {
        super(message);
    }

    public abstract ExclusionReason getReason();
}
