package com.pgworkload.log.parser.template;

import java.util.ArrayList;
import java.util.List;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.parser.Lexer;
import com.alibaba.druid.sql.parser.ParserException;
import com.alibaba.druid.sql.parser.SQLParserUtils;
import com.alibaba.druid.sql.parser.Token;

/**
 * Splits SQL text into tokens with Druid's PostgreSQL lexer. Whitespace and
 * comments are skipped; every returned token keeps its exact source text and
 * offsets.
 * <p>
 * Druid lexes identifiers, keywords, numbers, operators, punctuation, plain
 * and {@code N''} strings and quoted identifiers. The PostgreSQL forms it
 * does not know are scanned here: {@code $n} parameters, dollar quotes,
 * {@code E''}, {@code U&''}, {@code B''} and {@code X''} literals, strings
 * continued across a newline, and nested block comments.
 * <p>
 * Instances hold no state and can be shared between threads.
 */
public class SqlScanner {

    public List<SqlToken> scan(String sql) throws TokenizationException {
        List<SqlToken> tokens = new ArrayList<>();
        Lexer lexer = SQLParserUtils.createLexer(sql, DbType.postgresql);
        int n = sql.length();
        // Druid's PostgreSQL strings take backslash escapes, standard ones do not
        int lastBackslash = sql.lastIndexOf('\\');
        int pos = skipGap(sql, 0);

        while (pos < n) {
            char c = sql.charAt(pos);
            char next = charAt(sql, pos + 1);
            int start = pos;
            TokenType type;

            if (Character.isISOControl(c)) {
                throw new TokenizationException(
                        String.format("Unexpected control character U+%04X", (int) c), start);
            } else if (c == '$' && isDigit(next)) {
                pos = skipDigits(sql, start + 1);
                type = TokenType.PARAM;
            } else if (c == '$') {
                int end = scanDollarQuoted(sql, start);
                pos = end > 0 ? end : start + 1;
                type = end > 0 ? TokenType.STRING : TokenType.OTHER;
            } else if ((c == 'E' || c == 'e') && next == '\'') {
                pos = scanQuoted(sql, start, start + 2, true);
                type = TokenType.STRING;
            } else if ((c == 'B' || c == 'b' || c == 'X' || c == 'x') && next == '\'') {
                pos = scanQuoted(sql, start, start + 2, false);
                type = TokenType.BIT_STRING;
            } else if ((c == 'U' || c == 'u') && next == '&' && charAt(sql, pos + 2) == '\'') {
                pos = scanQuoted(sql, start, start + 3, false);
                type = TokenType.STRING;
            } else if ((c == 'U' || c == 'u') && next == '&' && charAt(sql, pos + 2) == '"') {
                pos = scanQuotedIdentifier(sql, start, start + 3);
                type = TokenType.QUOTED_IDENTIFIER;
            } else if (c == '\'' && start < lastBackslash) {
                pos = scanQuoted(sql, start, start + 1, false);
                type = TokenType.STRING;
            } else if ((c == 'N' || c == 'n') && next == '\'' && start < lastBackslash) {
                pos = scanQuoted(sql, start, start + 2, false);
                type = TokenType.STRING;
            } else if (c == '"' && start < lastBackslash) {
                pos = scanQuotedIdentifier(sql, start, start + 1);
                type = TokenType.QUOTED_IDENTIFIER;
            } else if (c == '-' && (isDigit(next) || next == '.')) {
                // Druid folds the sign into the number after ( and ,
                pos = start + 1;
                type = TokenType.OPERATOR;
            } else if (c == '/') {
                // Druid reads "/ *" as a comment opener
                pos = start + 1;
                type = TokenType.OPERATOR;
            } else if (c == ':' && next != ':' && next != '=') {
                pos = start + 1;
                type = TokenType.PUNCTUATION;
            } else {
                Token token = nextDruidToken(lexer, sql, start);
                pos = trimTrailingWhitespace(sql, start, lexer.pos());
                type = classify(token);
                if (token == Token.MONKEYS_AT_GT || token == Token.MONKEYS_AT_AT) {
                    // Druid steps one character past @> and @@
                    pos = start + 2;
                } else if (type == TokenType.IDENTIFIER) {
                    // # is an operator character in PostgreSQL, Druid takes it into identifiers
                    int sharp = sql.indexOf('#', start + 1);
                    if (sharp > 0 && sharp < pos) {
                        pos = sharp;
                    }
                } else if (type == TokenType.QUOTED_IDENTIFIER && pos - start == 2) {
                    throw new TokenizationException("Zero-length delimited identifier", start);
                } else if (type == TokenType.STRING) {
                    pos = continueString(sql, start, pos);
                }
            }

            if (pos <= start) {
                throw new TokenizationException("Unexpected character '" + c + "'", start);
            }
            tokens.add(new SqlToken(type, start, pos, sql.substring(start, pos)));
            pos = skipGap(sql, pos);
        }
        return tokens;
    }

    private static Token nextDruidToken(Lexer lexer, String sql, int start) throws TokenizationException {
        lexer.reset(start);
        try {
            lexer.nextToken();
        } catch (ParserException e) {
            throw new TokenizationException(e.getMessage(), start);
        } catch (ArrayIndexOutOfBoundsException e) {
            // CharTypes tables are indexed with <= length, U+0100 overruns them
            throw new TokenizationException("Unexpected character '" + sql.charAt(start) + "'", start);
        }
        Token token = lexer.token();
        if (token == Token.ERROR) {
            char c = sql.charAt(start);
            throw new TokenizationException(
                    c == '\'' || c == 'N' || c == 'n' ? "Unterminated quoted string" : "Unexpected character '" + c + "'",
                    start);
        }
        return token;
    }

    private static TokenType classify(Token token) {
        switch (token) {
            case LITERAL_INT:
            case LITERAL_HEX:
            case BITS:
                return TokenType.INTEGER;
            case LITERAL_FLOAT:
                return TokenType.FLOAT;
            case LITERAL_CHARS:
            case LITERAL_NCHARS:
                return TokenType.STRING;
            case LITERAL_ALIAS:
                return TokenType.QUOTED_IDENTIFIER;
            case COMMA:
            case LPAREN:
            case RPAREN:
            case LBRACKET:
            case RBRACKET:
            case LBRACE:
            case RBRACE:
            case SEMI:
            case DOT:
            case DOTDOT:
            case DOTDOTDOT:
                return TokenType.PUNCTUATION;
            case VARIANT:
                return TokenType.OTHER;
            case IDENTIFIER:
                return TokenType.IDENTIFIER;
            default:
                // keywords carry their upper-case name, operators their symbol
                return token.name != null && Character.isLetter(token.name.charAt(0))
                        ? TokenType.IDENTIFIER
                        : TokenType.OPERATOR;
        }
    }

    /**
     * Skips whitespace and comments. Block comments nest.
     *
     * @return offset of the next token, or the text length
     */
    private static int skipGap(String sql, int pos) throws TokenizationException {
        int n = sql.length();
        while (pos < n) {
            char c = sql.charAt(pos);
            if (isWhitespace(c)) {
                pos++;
            } else if (sql.startsWith("--", pos)) {
                while (pos < n && sql.charAt(pos) != '\n' && sql.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (sql.startsWith("/*", pos)) {
                pos = skipBlockComment(sql, pos);
            } else {
                break;
            }
        }
        return pos;
    }

    private static int skipBlockComment(String sql, int start) throws TokenizationException {
        int n = sql.length();
        int depth = 0;
        int pos = start;
        while (pos < n) {
            if (sql.startsWith("/*", pos)) {
                depth++;
                pos += 2;
            } else if (sql.startsWith("*/", pos)) {
                depth--;
                pos += 2;
                if (depth == 0) {
                    return pos;
                }
            } else {
                pos++;
            }
        }
        throw new TokenizationException("Unterminated /* comment", start);
    }

    /**
     * Scans a single-quoted literal whose body starts at {@code bodyStart}.
     * {@code ''} is an escaped quote; with {@code backslashEscapes} so is
     * {@code \'}.
     *
     * @return offset just past the closing quote of the last continued segment
     */
    private static int scanQuoted(String sql, int tokenStart, int bodyStart, boolean backslashEscapes)
            throws TokenizationException {
        int n = sql.length();
        int pos = bodyStart;
        while (pos < n) {
            char c = sql.charAt(pos);
            if (backslashEscapes && c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\'') {
                if (pos + 1 < n && sql.charAt(pos + 1) == '\'') {
                    pos += 2;
                    continue;
                }
                int continued = continuation(sql, pos + 1);
                if (continued > 0) {
                    pos = continued;
                    continue;
                }
                return pos + 1;
            }
            pos++;
        }
        throw new TokenizationException("Unterminated quoted string", tokenStart);
    }

    private static int continueString(String sql, int tokenStart, int end) throws TokenizationException {
        int continued = continuation(sql, end);
        return continued > 0 ? scanQuoted(sql, tokenStart, continued, false) : end;
    }

    /**
     * Two literals separated only by whitespace that contains a newline are
     * one literal.
     *
     * @return offset of the body of the continuing literal, or -1
     */
    private static int continuation(String sql, int after) {
        int n = sql.length();
        int q = after;
        boolean sawNewline = false;
        while (q < n && isWhitespace(sql.charAt(q))) {
            if (sql.charAt(q) == '\n' || sql.charAt(q) == '\r') {
                sawNewline = true;
            }
            q++;
        }
        return sawNewline && q < n && sql.charAt(q) == '\'' ? q + 1 : -1;
    }

    private static int scanQuotedIdentifier(String sql, int tokenStart, int bodyStart) throws TokenizationException {
        int n = sql.length();
        int pos = bodyStart;
        while (pos < n) {
            if (sql.charAt(pos) == '"') {
                if (pos + 1 < n && sql.charAt(pos + 1) == '"') {
                    pos += 2;
                    continue;
                }
                if (pos == bodyStart) {
                    throw new TokenizationException("Zero-length delimited identifier", tokenStart);
                }
                return pos + 1;
            }
            pos++;
        }
        throw new TokenizationException("Unterminated quoted identifier", tokenStart);
    }

    /**
     * @return offset past the closing tag, or -1 if the {@code $} at
     *         {@code start} does not open a dollar quote
     */
    private static int scanDollarQuoted(String sql, int start) throws TokenizationException {
        int n = sql.length();
        int pos = start + 1;
        if (pos < n && sql.charAt(pos) != '$') {
            if (!isTagStart(sql.charAt(pos))) {
                return -1;
            }
            while (pos < n && isTagPart(sql.charAt(pos))) {
                pos++;
            }
        }
        if (pos >= n || sql.charAt(pos) != '$') {
            return -1;
        }
        String tag = sql.substring(start, pos + 1);
        int close = sql.indexOf(tag, pos + 1);
        if (close == -1) {
            throw new TokenizationException("Unterminated dollar-quoted string", start);
        }
        return close + tag.length();
    }

    // Druid's = < and ! scanners step over a following blank
    private static int trimTrailingWhitespace(String sql, int start, int end) {
        while (end > start && isWhitespace(sql.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static int skipDigits(String sql, int pos) {
        while (pos < sql.length() && isDigit(sql.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static char charAt(String sql, int index) {
        return index < sql.length() ? sql.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(char c) {
        switch (c) {
            case ' ':
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case '\u00A0':
            case '\u3000':
                return true;
            default:
                return false;
        }
    }

    private static boolean isTagStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= '\u0080';
    }

    private static boolean isTagPart(char c) {
        return isTagStart(c) || isDigit(c);
    }
}
