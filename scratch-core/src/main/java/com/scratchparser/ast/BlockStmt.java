package com.scratchparser.ast;

import java.util.List;

public record BlockStmt(List<Statement> body) implements Statement {

    public BlockStmt {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "BlockStmt";
    }
}
