package com.scratchparser;

/**
 * A numeric literal does not fit a signed 64-bit integer.
 */
public final class InvalidNumberException extends ParseException {

    private final String text;

    public InvalidNumberException(String text, Throwable cause) {
        super("Invalid numeric literal: \"" + text + "\"", cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
