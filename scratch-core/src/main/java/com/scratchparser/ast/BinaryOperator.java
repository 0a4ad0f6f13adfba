package com.scratchparser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum BinaryOperator implements Operator {
    INVALID("InvalidBinaryOp"),

    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),

    GT(">"),
    LT("<"),
    GTE(">="),
    LTE("<="),

    EQ("=="),
    NEQ("!=");

    private static final Map<String, BinaryOperator> BY_SYMBOL = Arrays.stream(values())
        .filter(op -> op != INVALID)
        .collect(Collectors.toUnmodifiableMap(BinaryOperator::symbol, Function.identity()));

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its source spelling, returning {@link #INVALID} when there is none.
     */
    public static BinaryOperator fromSymbol(String symbol) {
        return BY_SYMBOL.getOrDefault(symbol, INVALID);
    }
}
