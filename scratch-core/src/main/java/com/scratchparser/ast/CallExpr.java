package com.scratchparser.ast;

import java.util.List;

public record CallExpr(Expression callee, List<Expression> args) implements Expression {

    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "CallExpr";
    }
}
