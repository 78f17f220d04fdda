package com.pgworkload.log.parser;

import java.util.List;

/**
 * Puts bind parameter values back into a prepared statement.
 */
public class ParameterSubstitutor {

    /**
     * Replaces each {@code $n} key with its value in one left-to-right pass.
     * At every {@code $} the keys are tried from the highest index down, so
     * {@code $12} is matched before {@code $1}. Substituted text is never
     * scanned again and keys missing from the map stay as they are.
     */
    public String substitute(String rawQuery, ParameterMap params) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        if (params.isEmpty() || rawQuery.indexOf('$') == -1) {
            return rawQuery;
        }
        List<BindParameter> keys = params.descending();
        StringBuilder sb = new StringBuilder(rawQuery.length() + 16 * keys.size());
        int i = 0;
        while (i < rawQuery.length()) {
            char c = rawQuery.charAt(i);
            if (c == '$') {
                BindParameter match = null;
                for (BindParameter p : keys) {
                    if (rawQuery.startsWith(p.getKey(), i)) {
                        match = p;
                        break;
                    }
                }
                if (match != null) {
                    sb.append(match.getValue());
                    i += match.getKey().length();
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }
}
