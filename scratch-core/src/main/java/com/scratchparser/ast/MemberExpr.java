package com.scratchparser.ast;

/**
 * Property access. {@code computed} is true for {@code obj[prop]} and false for {@code obj.prop}.
 */
public record MemberExpr(boolean computed, Expression obj, Expression prop) implements Expression {

    @Override
    public String type() {
        return "MemberExpr";
    }
}
