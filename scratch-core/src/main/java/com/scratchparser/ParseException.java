package com.scratchparser;

/**
 * Base class for every lexical and syntax error. The first error aborts the parse; no
 * partial tree is produced.
 */
public abstract sealed class ParseException extends RuntimeException
    permits LexicalException,
            UnexpectedTokenException,
            UnexpectedEndOfInputException,
            UnknownLiteralException,
            UnknownOperatorException,
            InvalidLvalueException,
            InvalidNumberException {

    protected ParseException(String message) {
        super(message);
    }

    protected ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
