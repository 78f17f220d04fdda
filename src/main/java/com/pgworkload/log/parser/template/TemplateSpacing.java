package com.pgworkload.log.parser.template;

/**
 * How tokens are joined when a template is rebuilt.
 */
public enum TemplateSpacing {
    /** One space between every pair of tokens: {@code VALUES ( $1 , $2 )}. */
    TOKEN_SEPARATED,
    /** One space only where the source had whitespace or a comment: {@code VALUES ($1, $2)}. */
    GAP_PRESERVING;

    public static TemplateSpacing fromString(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (TemplateSpacing spacing : values()) {
            if (spacing.name().equals(normalized)) {
                return spacing;
            }
        }
        throw new IllegalArgumentException("Unknown template spacing: " + value);
    }
}
