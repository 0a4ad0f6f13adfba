package com.scratchparser.ast;

import java.util.List;

public record Program(List<Statement> body) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Program";
    }
}
