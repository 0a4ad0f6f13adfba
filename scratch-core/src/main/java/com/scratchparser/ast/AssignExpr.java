package com.scratchparser.ast;

public record AssignExpr(AssignOperator op, Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "AssignExpr";
    }
}
