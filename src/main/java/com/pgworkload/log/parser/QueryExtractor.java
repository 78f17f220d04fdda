package com.pgworkload.log.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the SQL statement embedded in a log message, e.g. the
 * {@code SELECT ...} part of {@code execute <unnamed>: SELECT ...}.
 */
public class QueryExtractor {

    private static final Pattern STATEMENT_START = Pattern.compile("\\b(?:DELETE|INSERT|SELECT|UPDATE)\\b");

    /**
     * @return everything from the first statement keyword to the end of the
     *         message, or an empty string if there is none
     */
    public String extract(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        Matcher m = STATEMENT_START.matcher(message);
        if (!m.find()) {
            return "";
        }
        return message.substring(m.start());
    }
}
