package com.scratchparser;

import com.scratchparser.UnknownOperatorException.OperatorKind;
import com.scratchparser.ast.NumericLit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every error aborts the parse at the first offending token.
 */
public class ParserErrorTest {

    private static Parser parserOver(Token... tokens) {
        Iterator<Token> iterator = List.of(tokens).iterator();
        return new Parser(() -> iterator.hasNext() ? iterator.next() : Token.eof(0));
    }

    @Test
    @DisplayName("Assigning to a literal is an invalid lvalue, not a token mismatch")
    void invalidLvalue() {
        InvalidLvalueException e = assertThrows(InvalidLvalueException.class, () -> Parser.parse("1 = 2;"));
        assertEquals(new NumericLit(1), e.getNode());
        assertThrows(InvalidLvalueException.class, () -> Parser.parse("a + b = 2;"));
        assertThrows(InvalidLvalueException.class, () -> Parser.parse("f() += 2;"));
    }

    @Test
    @DisplayName("The lvalue is checked before the right-hand side is parsed")
    void invalidLvalueReportedBeforeRightHandSide() {
        // A missing right-hand side would otherwise fail as an unknown literal
        assertThrows(InvalidLvalueException.class, () -> Parser.parse("1 = ;"));
    }

    @Test
    @DisplayName("A missing operand fails on the token where the primary expression was expected")
    void missingOperand() {
        UnknownLiteralException e = assertThrows(UnknownLiteralException.class, () -> Parser.parse("x +;"));
        assertEquals(TokenType.SEMICOLON, e.getType());
        assertEquals(";", e.getValue());
        assertEquals(3, e.getToken().position());
    }

    @Test
    void unexpectedToken() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("let 5;"));
        assertEquals(TokenType.NUMBER, e.getActual());
        assertEquals("5", e.getToken().value());
        assertEquals(TokenType.IDENTIFIER, e.getExpected());
    }

    @Test
    void missingSemicolon() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("x y;"));
        assertEquals(TokenType.IDENTIFIER, e.getActual());
        assertEquals(TokenType.SEMICOLON, e.getExpected());
    }

    @Test
    void variableInitializerNeedsSimpleAssign() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("let x += 1;"));
        assertEquals(TokenType.COMPLEX_ASSIGN, e.getActual());
        assertEquals(TokenType.SIMPLE_ASSIGN, e.getExpected());
    }

    @Test
    void unexpectedEndOfInput() {
        UnexpectedEndOfInputException e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("x"));
        assertEquals(TokenType.SEMICOLON, e.getExpected());

        e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("def f("));
        assertEquals(TokenType.IDENTIFIER, e.getExpected());

        e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("x +"));
        assertNull(e.getExpected());
    }

    @Test
    @DisplayName("An unclosed block reports the missing closing brace")
    void unclosedBlock() {
        UnexpectedEndOfInputException e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("{ x;"));
        assertEquals(TokenType.CLOSE_CURLY, e.getExpected());
        assertTrue(e.getMessage().contains("\"}\""), e.getMessage());

        e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("{"));
        assertEquals(TokenType.CLOSE_CURLY, e.getExpected());

        e = assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("class A { def m() { return 1; }"));
        assertEquals(TokenType.CLOSE_CURLY, e.getExpected());
    }

    @Test
    void emptyProgramIsAnError() {
        assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse(""));
        assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("  // only a comment\n"));
    }

    @Test
    void strayClosingBrace() {
        UnknownLiteralException e = assertThrows(UnknownLiteralException.class, () -> Parser.parse("x; }"));
        assertEquals(TokenType.CLOSE_CURLY, e.getType());
    }

    @Test
    @DisplayName("Unary plus is lexed but has no unary operator")
    void unaryPlus() {
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class, () -> Parser.parse("+x;"));
        assertEquals(OperatorKind.UNARY, e.getKind());
        assertEquals("+", e.getOperator());
    }

    @Test
    void unknownBinaryOperator() {
        Parser parser = parserOver(
            new Token(TokenType.IDENTIFIER, "a", 0),
            new Token(TokenType.MULTIPLICATIVE_OP, "%", 2),
            new Token(TokenType.IDENTIFIER, "b", 4),
            new Token(TokenType.SEMICOLON, ";", 6));
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class, parser::parse);
        assertEquals(OperatorKind.BINARY, e.getKind());
        assertEquals("%", e.getOperator());
    }

    @Test
    void unknownLogicalOperator() {
        Parser parser = parserOver(
            new Token(TokenType.IDENTIFIER, "a", 0),
            new Token(TokenType.AND_OP, "and", 2),
            new Token(TokenType.IDENTIFIER, "b", 6),
            new Token(TokenType.SEMICOLON, ";", 8));
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class, parser::parse);
        assertEquals(OperatorKind.LOGICAL, e.getKind());
    }

    @Test
    void unknownAssignOperator() {
        Parser parser = parserOver(
            new Token(TokenType.IDENTIFIER, "a", 0),
            new Token(TokenType.COMPLEX_ASSIGN, "%=", 2),
            new Token(TokenType.NUMBER, "1", 5),
            new Token(TokenType.SEMICOLON, ";", 7));
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class, parser::parse);
        assertEquals(OperatorKind.ASSIGN, e.getKind());
        assertEquals("%=", e.getOperator());
    }

    @Test
    void superMustBeCalled() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("super.x;"));
        assertEquals(TokenType.DOT, e.getActual());
        assertEquals(TokenType.OPEN_PAREN, e.getExpected());
    }

    @Test
    @DisplayName("The result of new is not called again")
    void newResultIsNotCallable() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("new X()();"));
        assertEquals(TokenType.OPEN_PAREN, e.getActual());
        assertEquals(TokenType.SEMICOLON, e.getExpected());
    }

    @Test
    @DisplayName("Parentheses around new do not make its result callable")
    void parenthesizedNewIsNotCallable() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("(new X())();"));
        assertEquals(TokenType.OPEN_PAREN, e.getActual());
        assertEquals(TokenType.SEMICOLON, e.getExpected());
    }

    @Test
    void newNeedsArguments() {
        assertThrows(UnexpectedTokenException.class, () -> Parser.parse("new X;"));
    }

    @Test
    void doWhileNeedsTrailingSemicolon() {
        assertThrows(UnexpectedEndOfInputException.class, () -> Parser.parse("do x; while (y)"));
    }

    @Test
    void numberTooLarge() {
        InvalidNumberException e = assertThrows(InvalidNumberException.class,
            () -> Parser.parse("99999999999999999999;"));
        assertEquals("99999999999999999999", e.getText());
    }

    @Test
    void lexicalErrorsAbortTheParse() {
        LexicalException e = assertThrows(LexicalException.class, () -> Parser.parse("let x = 1; let y = #;"));
        assertEquals(19, e.getPosition());
    }

    @Test
    void allErrorsAreParseExceptions() {
        for (String source : List.of("1 = 2;", "x +;", "let 5;", "x", "+x;", "#", "99999999999999999999;")) {
            assertThrows(ParseException.class, () -> Parser.parse(source), source);
        }
    }
}
