package com.scratchparser;

/**
 * Pull-based supply of tokens for the {@link Parser}.
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * Returns the next significant token. Once input is exhausted every call returns an
     * {@link TokenType#EOF} token.
     *
     * @throws LexicalException if the input at the cursor matches no lexical rule
     */
    Token nextToken();
}
