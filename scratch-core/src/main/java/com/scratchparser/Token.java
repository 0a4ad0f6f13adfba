package com.scratchparser;

/**
 * A lexical unit: its kind, the exact source text it matched and the offset where it starts.
 */
public record Token(TokenType type, String value, int position) {

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position);
    }

    public boolean is(TokenType other) {
        return type == other;
    }
}
