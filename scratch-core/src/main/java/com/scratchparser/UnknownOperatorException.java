package com.scratchparser;

/**
 * An operator token has no entry in the matching operator table.
 */
public final class UnknownOperatorException extends ParseException {

    public enum OperatorKind {
        BINARY("binary"),
        LOGICAL("logical"),
        UNARY("unary"),
        ASSIGN("assign");

        private final String description;

        OperatorKind(String description) {
            this.description = description;
        }
    }

    private final OperatorKind kind;
    private final String operator;

    public UnknownOperatorException(OperatorKind kind, String operator) {
        super("Unknown " + kind.description + " operator: \"" + operator + "\"");
        this.kind = kind;
        this.operator = operator;
    }

    public OperatorKind getKind() {
        return kind;
    }

    public String getOperator() {
        return operator;
    }
}
