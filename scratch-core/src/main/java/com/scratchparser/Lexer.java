package com.scratchparser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * On-demand tokenizer. Each {@link #nextToken()} call applies the rule table at the cursor
 * and advances past the match; nothing is buffered beyond the cursor itself.
 */
public class Lexer implements TokenSource {

    private final String source;
    private final List<LexicalRule> rules;
    private int cursor = 0;

    public Lexer(String source) {
        this(LexicalRules.DEFAULT, source);
    }

    public Lexer(List<LexicalRule> rules, String source) {
        this.rules = List.copyOf(rules);
        this.source = source;
    }

    @Override
    public Token nextToken() {
        while (cursor < source.length()) {
            Token token = matchAtCursor();
            if (!token.is(TokenType.SKIP)) {
                return token;
            }
        }
        return Token.eof(source.length());
    }

    /**
     * Drains the remaining input. The returned list always ends with the EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token matchAtCursor() {
        for (LexicalRule rule : rules) {
            // Region bounds are opaque, so \b at the cursor behaves as at the start of input
            Matcher matcher = rule.pattern().matcher(source).region(cursor, source.length());
            if (matcher.lookingAt() && matcher.end() > cursor) {
                int start = cursor;
                cursor = matcher.end();
                return new Token(rule.type(), matcher.group(), start);
            }
        }
        throw new LexicalException(cursor, source.substring(cursor));
    }
}
