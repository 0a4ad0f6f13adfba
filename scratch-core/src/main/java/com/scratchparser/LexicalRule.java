package com.scratchparser;

import java.util.regex.Pattern;

/**
 * Pairs a token kind with the pattern that recognizes it at the lexer cursor.
 */
public record LexicalRule(TokenType type, Pattern pattern) {

    public static LexicalRule of(TokenType type, String regex) {
        return new LexicalRule(type, Pattern.compile(regex));
    }
}
