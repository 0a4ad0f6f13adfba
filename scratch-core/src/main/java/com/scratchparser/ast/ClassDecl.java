package com.scratchparser.ast;

/**
 * Class declaration. The body is a block; member functions are ordinary {@link FuncDecl}
 * statements inside it.
 */
public record ClassDecl(
    Identifier id,
    Identifier superClass,  // Can be null, written as "super"
    BlockStmt body
) implements Statement {

    @Override
    public String type() {
        return "ClassDecl";
    }
}
