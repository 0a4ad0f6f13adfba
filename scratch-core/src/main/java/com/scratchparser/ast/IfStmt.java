package com.scratchparser.ast;

public record IfStmt(
    Expression cond,
    Statement cons,
    Statement alt  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "IfStmt";
    }
}
