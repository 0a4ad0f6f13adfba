package com.scratchparser.json;

/**
 * Exception thrown when a syntax tree cannot be written as JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
