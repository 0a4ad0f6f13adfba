package com.scratchparser.ast;

public record NullLit() implements Expression {

    @Override
    public String type() {
        return "NullLit";
    }
}
