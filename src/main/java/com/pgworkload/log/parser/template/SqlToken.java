package com.pgworkload.log.parser.template;

public final class SqlToken {

    private final TokenType type;
    private final int start;
    private final int end;
    private final String text;

    public SqlToken(TokenType type, int start, int end, String text) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public TokenType getType() {
        return type;
    }

    /** Offset of the first character. */
    public int getStart() {
        return start;
    }

    /** Offset just past the last character. */
    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return type.getType() + "[" + start + "," + end + ")='" + text + "'";
    }
}
