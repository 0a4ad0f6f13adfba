package com.scratchparser.ast;

public record ReturnStmt(
    Expression arg  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "ReturnStmt";
    }
}
