package com.scratchparser.ast;

/**
 * Common view of the operator enumerations: each constant has a canonical source spelling.
 */
public interface Operator {

    String symbol();
}
