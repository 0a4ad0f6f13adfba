package com.scratchparser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum AssignOperator implements Operator {
    INVALID("InvalidAssignOp"),

    SIMPLE("="),
    ADD("+="),
    SUB("-="),
    MUL("*="),
    DIV("/=");

    private static final Map<String, AssignOperator> BY_SYMBOL = Arrays.stream(values())
        .filter(op -> op != INVALID)
        .collect(Collectors.toUnmodifiableMap(AssignOperator::symbol, Function.identity()));

    private final String symbol;

    AssignOperator(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public static AssignOperator fromSymbol(String symbol) {
        return BY_SYMBOL.getOrDefault(symbol, INVALID);
    }
}
