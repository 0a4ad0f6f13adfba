package com.scratchparser;

import java.util.List;

import static com.scratchparser.TokenType.*;

/**
 * The default rule table.
 *
 * <p>Rules are tried in order and the first one that matches wins, so longer operators
 * must precede their single character prefixes and keywords must precede
 * {@link TokenType#IDENTIFIER}.</p>
 */
public final class LexicalRules {

    public static final List<LexicalRule> DEFAULT = List.of(
        // Whitespace and comments
        LexicalRule.of(SKIP, "\\s+"),
        LexicalRule.of(SKIP, "//.*"),
        LexicalRule.of(SKIP, "/\\*[\\s\\S]*?\\*/"),

        // Punctuation
        LexicalRule.of(SEMICOLON, ";"),
        LexicalRule.of(OPEN_CURLY, "\\{"),
        LexicalRule.of(CLOSE_CURLY, "\\}"),
        LexicalRule.of(OPEN_PAREN, "\\("),
        LexicalRule.of(CLOSE_PAREN, "\\)"),
        LexicalRule.of(COMMA, ","),
        LexicalRule.of(DOT, "\\."),
        LexicalRule.of(OPEN_SQUARE, "\\["),
        LexicalRule.of(CLOSE_SQUARE, "]"),

        // Keywords
        LexicalRule.of(LET, "\\blet\\b"),
        LexicalRule.of(DEF, "\\bdef\\b"),
        LexicalRule.of(RETURN, "\\breturn\\b"),
        LexicalRule.of(IF, "\\bif\\b"),
        LexicalRule.of(WHILE, "\\bwhile\\b"),
        LexicalRule.of(DO, "\\bdo\\b"),
        LexicalRule.of(CLASS, "\\bclass\\b"),
        LexicalRule.of(THIS, "\\bthis\\b"),
        LexicalRule.of(EXTENDS, "\\bextends\\b"),
        LexicalRule.of(SUPER, "\\bsuper\\b"),
        LexicalRule.of(NEW, "\\bnew\\b"),
        LexicalRule.of(FOR, "\\bfor\\b"),
        LexicalRule.of(ELSE, "\\belse\\b"),
        LexicalRule.of(TRUE, "\\btrue\\b"),
        LexicalRule.of(FALSE, "\\bfalse\\b"),
        LexicalRule.of(NULL, "\\bnull\\b"),

        // Literals and names
        LexicalRule.of(NUMBER, "\\d+"),
        LexicalRule.of(STRING, "\"[^\"]*\""),
        LexicalRule.of(STRING, "'[^']*'"),
        LexicalRule.of(IDENTIFIER, "\\w+"),

        // Operators
        LexicalRule.of(EQUALITY_OP, "[=!]="),
        LexicalRule.of(SIMPLE_ASSIGN, "="),
        LexicalRule.of(COMPLEX_ASSIGN, "[+\\-*/]="),
        LexicalRule.of(NOT_OP, "!"),
        LexicalRule.of(AND_OP, "&&"),
        LexicalRule.of(OR_OP, "\\|\\|"),
        LexicalRule.of(RELATIONAL_OP, "[<>]=?"),
        LexicalRule.of(ADDITIVE_OP, "[+\\-]"),
        LexicalRule.of(MULTIPLICATIVE_OP, "[*/]")
    );

    private LexicalRules() {
        // Utility class
    }
}
