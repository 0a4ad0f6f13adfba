package com.scratchparser;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 *
 * <p>Operator kinds group several spellings (for example {@link #ADDITIVE_OP} covers
 * both {@code +} and {@code -}); the parser maps the token text to a concrete operator.</p>
 */
public enum TokenType {
    // Sentinels
    EOF("EOF"),
    SKIP("Skip"),   // whitespace and comments, never handed to the parser

    // Punctuation
    SEMICOLON(";"),
    OPEN_CURLY("{"),
    CLOSE_CURLY("}"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    COMMA(","),
    DOT("."),
    OPEN_SQUARE("["),
    CLOSE_SQUARE("]"),

    // Keywords
    LET("let"),
    DEF("def"),
    RETURN("return"),
    IF("if"),
    WHILE("while"),
    DO("do"),
    CLASS("class"),
    THIS("this"),
    EXTENDS("extends"),
    SUPER("super"),
    NEW("new"),
    FOR("for"),
    ELSE("else"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),

    // Literals and names
    NUMBER("Number"),
    STRING("String"),
    IDENTIFIER("Identifier"),

    // Operators
    EQUALITY_OP("EqualityOp"),             // == !=
    SIMPLE_ASSIGN("="),
    COMPLEX_ASSIGN("ComplexAssign"),       // += -= *= /=
    NOT_OP("NotLogicalOp"),                // !
    AND_OP("AndLogicalOp"),                // &&
    OR_OP("OrLogicalOp"),                  // ||
    RELATIONAL_OP("RelationalOp"),         // > < >= <=
    ADDITIVE_OP("AdditiveOp"),             // + -
    MULTIPLICATIVE_OP("MultiplicativeOp"); // * /

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /**
     * Human readable name used in diagnostics.
     */
    public String label() {
        return label;
    }
}
