package com.scratchparser.ast;

public record SuperCall() implements Expression {

    @Override
    public String type() {
        return "SuperCall";
    }
}
