package com.scratchparser.ast;

import java.util.List;

/**
 * Function declaration. {@code params} is {@code null} when the parameter list is empty,
 * which keeps it distinct from an explicitly empty list.
 */
public record FuncDecl(
    Identifier name,
    List<Identifier> params,
    BlockStmt body
) implements Statement {

    public FuncDecl {
        params = params != null ? List.copyOf(params) : null;
    }

    @Override
    public String type() {
        return "FuncDecl";
    }
}
