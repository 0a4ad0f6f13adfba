package com.scratchparser.ast;

public record UnaryExpr(UnaryOperator op, Expression arg) implements Expression {

    @Override
    public String type() {
        return "UnaryExpr";
    }
}
