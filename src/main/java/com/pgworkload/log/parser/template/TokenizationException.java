package com.pgworkload.log.parser.template;

import com.pgworkload.log.parser.ExclusionReason;
import com.pgworkload.log.parser.WorkloadParseException;

/**
 * The scanner met text that belongs to no token class, such as an
 * unterminated quoted literal.
 */
public class TokenizationException extends WorkloadParseException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public TokenizationException(String problem, int position) {
        super(problem + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public ExclusionReason getReason() {
        return ExclusionReason.TOKENIZATION_FAILED;
    }
}
