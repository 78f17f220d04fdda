package com.pgworkload.log.parser;

public enum ExclusionReason {
    NO_QUERY("no_query", "No DELETE/INSERT/SELECT/UPDATE statement in message"),
    MALFORMED_PARAMETERS("malformed_parameters", "Detail parameters do not match '$n = value'"),
    TOKENIZATION_FAILED("tokenization_failed", "Statement could not be tokenized");

    private final String code;
    private final String description;

    ExclusionReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
