package com.scratchparser.ast;

public record EmptyStmt() implements Statement {

    @Override
    public String type() {
        return "EmptyStmt";
    }
}
