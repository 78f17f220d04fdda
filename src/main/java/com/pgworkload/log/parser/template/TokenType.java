package com.pgworkload.log.parser.template;

public enum TokenType {
    IDENTIFIER("identifier", false),
    QUOTED_IDENTIFIER("quoted_identifier", false),
    INTEGER("integer", true),
    FLOAT("float", true),
    STRING("string", true),
    BIT_STRING("bit_string", false),
    PARAM("param", false),
    OPERATOR("operator", false),
    PUNCTUATION("punctuation", false),
    OTHER("other", false);

    TokenType(final String pType, final boolean pConstant) {
        this.type = pType;
        this.constant = pConstant;
    }

    private final String type;
    private final boolean constant;

    public String getType() {
        return type;
    }

    /**
     * True for the scalar literals that a template replaces with a placeholder.
     */
    public boolean isConstant() {
        return constant;
    }
}
