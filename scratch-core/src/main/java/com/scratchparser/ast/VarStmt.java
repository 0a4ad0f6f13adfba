package com.scratchparser.ast;

import java.util.List;

public record VarStmt(List<VarDecl> decls) implements Statement {

    public VarStmt {
        decls = List.copyOf(decls);
    }

    @Override
    public String type() {
        return "VarStmt";
    }
}
