package com.scratchparser.ast;

public record NumericLit(long value) implements Expression {

    @Override
    public String type() {
        return "NumericLit";
    }
}
