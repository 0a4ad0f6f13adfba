package com.scratchparser.ast;

public record WhileStmt(Expression cond, Statement body) implements Statement {

    @Override
    public String type() {
        return "WhileStmt";
    }
}
