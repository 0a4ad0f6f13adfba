package com.scratchparser.ast;

/**
 * Base interface for all syntax tree nodes.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    VarDecl {

    /**
     * The node kind name, as written to the {@code "type"} property of the JSON document.
     */
    String type();
}
