package com.scratchparser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum UnaryOperator implements Operator {
    INVALID("InvalidUnaryOp"),

    NOT("!"),
    NEG("-");

    private static final Map<String, UnaryOperator> BY_SYMBOL = Arrays.stream(values())
        .filter(op -> op != INVALID)
        .collect(Collectors.toUnmodifiableMap(UnaryOperator::symbol, Function.identity()));

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public static UnaryOperator fromSymbol(String symbol) {
        return BY_SYMBOL.getOrDefault(symbol, INVALID);
    }
}
