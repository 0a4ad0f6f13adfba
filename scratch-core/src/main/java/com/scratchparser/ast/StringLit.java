package com.scratchparser.ast;

public record StringLit(String value) implements Expression {

    @Override
    public String type() {
        return "StringLit";
    }
}
