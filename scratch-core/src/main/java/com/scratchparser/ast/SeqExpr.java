package com.scratchparser.ast;

import java.util.List;

/**
 * Comma separated expressions. The parser only builds one for two or more elements.
 */
public record SeqExpr(List<Expression> body) implements Expression {

    public SeqExpr {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "SeqExpr";
    }
}
