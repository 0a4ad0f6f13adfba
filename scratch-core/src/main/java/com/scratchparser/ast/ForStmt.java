package com.scratchparser.ast;

/**
 * {@code for (init; cond; step) body}. Every clause is optional.
 */
public record ForStmt(
    Node init,       // VarStmt or Expression, can be null
    Expression cond, // Can be null
    Expression step, // Can be null
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForStmt";
    }
}
