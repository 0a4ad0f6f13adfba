package com.scratchparser.ast;

import java.util.List;

public record NewExpr(Expression callee, List<Expression> args) implements Expression {

    public NewExpr {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "NewExpr";
    }
}
