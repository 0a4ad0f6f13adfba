package com.scratchparser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum LogicalOperator implements Operator {
    INVALID("InvalidLogicalOp"),

    AND("&&"),
    OR("||");

    private static final Map<String, LogicalOperator> BY_SYMBOL = Arrays.stream(values())
        .filter(op -> op != INVALID)
        .collect(Collectors.toUnmodifiableMap(LogicalOperator::symbol, Function.identity()));

    private final String symbol;

    LogicalOperator(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public static LogicalOperator fromSymbol(String symbol) {
        return BY_SYMBOL.getOrDefault(symbol, INVALID);
    }
}
