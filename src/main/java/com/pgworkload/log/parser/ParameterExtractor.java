package com.pgworkload.log.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses bind parameter values out of a detail column such as
 * {@code parameters: $1 = '42', $2 = 'abc'}.
 * <p>
 * By default pairs are split on every {@code ", "}, so a value that itself
 * contains that sequence breaks the record. With quote-aware splitting the
 * separator is only honoured outside single-quoted values.
 */
public class ParameterExtractor {

    static final String MARKER = "parameters: ";
    static final String PAIR_SEPARATOR = ", ";
    static final String KEY_VALUE_SEPARATOR = " = ";

    private static final Pattern KEY = Pattern.compile("^\\$[0-9]+$");
    private static final Pattern STRICT_SPLIT = Pattern.compile(PAIR_SEPARATOR, Pattern.LITERAL);

    private final boolean quoteAware;

    public ParameterExtractor() {
        this(false);
    }

    public ParameterExtractor(boolean quoteAware) {
        this.quoteAware = quoteAware;
    }

    public ParameterMap extract(String detail) throws MalformedParameterException {
        return extract(detail, null);
    }

    /**
     * @param record used only to name the record in error messages, may be null
     * @throws MalformedParameterException if a pair lacks {@code " = "}, has a
     *             key other than {@code $n}, or repeats an index
     */
    public ParameterMap extract(String detail, LogRecord record) throws MalformedParameterException {
        if (detail == null) {
            return ParameterMap.empty();
        }
        int idx = detail.indexOf(MARKER);
        if (idx == -1) {
            return ParameterMap.empty();
        }
        String parameterList = detail.substring(idx + MARKER.length());

        List<BindParameter> parameters = new ArrayList<>();
        for (String pair : split(parameterList)) {
            int sep = pair.indexOf(KEY_VALUE_SEPARATOR);
            if (sep == -1) {
                throw malformed(pair, "Missing '" + KEY_VALUE_SEPARATOR + "'", record);
            }
            String key = pair.substring(0, sep);
            if (!KEY.matcher(key).matches()) {
                throw malformed(pair, "Parameter key is not of the form $n", record);
            }
            try {
                parameters.add(new BindParameter(key, pair.substring(sep + KEY_VALUE_SEPARATOR.length())));
            } catch (IllegalArgumentException e) {
                throw malformed(pair, e.getMessage(), record);
            }
        }

        try {
            return ParameterMap.of(parameters);
        } catch (IllegalArgumentException e) {
            throw malformed(parameterList, e.getMessage(), record);
        }
    }

    List<String> split(String parameterList) {
        if (!quoteAware) {
            return List.of(STRICT_SPLIT.split(parameterList, -1));
        }
        List<String> pairs = new ArrayList<>();
        boolean inQuote = false;
        int start = 0;
        for (int i = 0; i < parameterList.length(); i++) {
            char c = parameterList.charAt(i);
            // a doubled '' closes and reopens the quote, which leaves us inside it
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote && parameterList.startsWith(PAIR_SEPARATOR, i)) {
                pairs.add(parameterList.substring(start, i));
                start = i + PAIR_SEPARATOR.length();
                i = start - 1;
            }
        }
        pairs.add(parameterList.substring(start));
        return pairs;
    }

    private static MalformedParameterException malformed(String pair, String problem, LogRecord record) {
        return record != null ? new MalformedParameterException(pair, problem, record)
                : new MalformedParameterException(pair, problem);
    }
}
