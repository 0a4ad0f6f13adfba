package com.scratchparser;

/**
 * The literal production was reached with a token that is not a literal.
 */
public final class UnknownLiteralException extends ParseException {

    private final Token token;

    public UnknownLiteralException(Token token) {
        super("Unknown literal type " + token.type().label() + ": \"" + token.value() + "\" at position " + token.position());
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getType() {
        return token.type();
    }

    public String getValue() {
        return token.value();
    }
}
