package com.scratchparser.ast;

public record BinaryExpr(BinaryOperator op, Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "BinaryExpr";
    }
}
