package com.scratchparser.ast;

public record LogicalExpr(LogicalOperator op, Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "LogicalExpr";
    }
}
