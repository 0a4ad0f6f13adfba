package com.scratchparser.ast;

public record Identifier(String name) implements Expression {

    @Override
    public String type() {
        return "Identifier";
    }
}
