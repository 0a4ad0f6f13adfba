package com.scratchparser;

import com.scratchparser.ast.Node;

/**
 * Assignment to something other than an identifier or member access.
 */
public final class InvalidLvalueException extends ParseException {

    private final transient Node node;

    public InvalidLvalueException(Node node) {
        super("Invalid left-hand side in assignment: " + node.type());
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
