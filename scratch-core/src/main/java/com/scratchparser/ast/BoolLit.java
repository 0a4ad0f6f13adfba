package com.scratchparser.ast;

public record BoolLit(boolean value) implements Expression {

    @Override
    public String type() {
        return "BoolLit";
    }
}
