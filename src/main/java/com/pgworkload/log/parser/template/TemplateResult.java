package com.pgworkload.log.parser.template;

import java.util.Collections;
import java.util.List;

public final class TemplateResult {

    private static final TemplateResult EMPTY = new TemplateResult("", Collections.emptyList());

    private final String template;
    private final List<String> params;

    public TemplateResult(String template, List<String> params) {
        this.template = template;
        this.params = Collections.unmodifiableList(params);
    }

    public static TemplateResult empty() {
        return EMPTY;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * Source text of each replaced constant or leftover parameter; element {@code i} belongs to
     * placeholder {@code $(i+1)}.
     */
    public List<String> getParams() {
        return params;
    }

    public boolean isEmpty() {
        return template.isEmpty();
    }

    @Override
    public int hashCode() {
        return 31 * template.hashCode() + params.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        TemplateResult other = (TemplateResult) obj;
        return template.equals(other.template) && params.equals(other.params);
    }

    @Override
    public String toString() {
        return template + " " + params;
    }
}
