package com.pgworkload.log.parser.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a literal SQL statement into a template: every integer, float
 * and string constant becomes {@code $1, $2, ...} in order of appearance,
 * and the replaced source texts are returned alongside. A {@code $n}
 * parameter left in the statement is a placeholder too: it is renumbered in
 * the same sequence and its text kept as the value.
 * <p>
 * {@code INSERT INTO t VALUES (1, 'a', 2.5)} becomes
 * {@code INSERT INTO t VALUES ( $1 , $2 , $3 )} with params
 * {@code [1, 'a', 2.5]}.
 */
public class SqlTemplater {

    private final SqlScanner scanner;
    private final TemplateSpacing spacing;

    public SqlTemplater() {
        this(TemplateSpacing.TOKEN_SEPARATED);
    }

    public SqlTemplater(TemplateSpacing spacing) {
        this(new SqlScanner(), spacing);
    }

    public SqlTemplater(SqlScanner scanner, TemplateSpacing spacing) {
        this.scanner = scanner;
        this.spacing = spacing;
    }

    /**
     * @throws TokenizationException if the statement contains an unterminated
     *             literal, identifier or comment, or an unclassifiable character
     */
    public TemplateResult template(String sql) throws TokenizationException {
        if (sql == null || sql.isEmpty()) {
            return TemplateResult.empty();
        }
        List<SqlToken> tokens = scanner.scan(sql);

        StringBuilder out = new StringBuilder(sql.length());
        List<String> params = new ArrayList<>();
        SqlToken previous = null;
        for (SqlToken token : tokens) {
            if (previous != null
                    && (spacing == TemplateSpacing.TOKEN_SEPARATED || token.getStart() > previous.getEnd())) {
                out.append(' ');
            }
            if (token.getType().isConstant() || token.getType() == TokenType.PARAM) {
                params.add(token.getText());
                out.append('$').append(params.size());
            } else {
                out.append(token.getText());
            }
            previous = token;
        }
        return new TemplateResult(out.toString(), params);
    }

    public TemplateSpacing getSpacing() {
        return spacing;
    }
}
