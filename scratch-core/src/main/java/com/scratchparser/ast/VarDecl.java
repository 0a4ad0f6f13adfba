package com.scratchparser.ast;

public record VarDecl(
    Identifier id,
    Expression init  // Can be null
) implements Node {

    @Override
    public String type() {
        return "VarDecl";
    }
}
