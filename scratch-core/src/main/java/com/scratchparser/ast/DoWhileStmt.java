package com.scratchparser.ast;

public record DoWhileStmt(Expression cond, Statement body) implements Statement {

    @Override
    public String type() {
        return "DoWhileStmt";
    }
}
