package com.scratchparser;

/**
 * Input ran out while a production still required a token.
 */
public final class UnexpectedEndOfInputException extends ParseException {

    private final TokenType expected;

    /**
     * @param expected the token kind that was required, or {@code null} when any expression
     *                 could have started here
     */
    public UnexpectedEndOfInputException(TokenType expected) {
        super("Unexpected end of input, expected: " + (expected != null ? "\"" + expected.label() + "\"" : "expression"));
        this.expected = expected;
    }

    public TokenType getExpected() {
        return expected;
    }
}
