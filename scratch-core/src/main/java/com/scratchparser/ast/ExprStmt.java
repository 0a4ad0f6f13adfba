package com.scratchparser.ast;

public record ExprStmt(Expression expr) implements Statement {

    @Override
    public String type() {
        return "ExprStmt";
    }
}
