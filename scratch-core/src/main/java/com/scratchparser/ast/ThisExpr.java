package com.scratchparser.ast;

public record ThisExpr() implements Expression {

    @Override
    public String type() {
        return "ThisExpr";
    }
}
