package com.scratchparser;

/**
 * The parser required one token kind and found a different one.
 */
public final class UnexpectedTokenException extends ParseException {

    private final Token token;
    private final TokenType expected;

    public UnexpectedTokenException(Token token, TokenType expected) {
        super("Unexpected token " + token.type().label() + " \"" + token.value() + "\" at position "
            + token.position() + ", expected: \"" + expected.label() + "\"");
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getActual() {
        return token.type();
    }

    public TokenType getExpected() {
        return expected;
    }
}
