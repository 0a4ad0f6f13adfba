package com.scratchparser;

/**
 * No lexical rule matches at the cursor.
 */
public final class LexicalException extends ParseException {

    private static final int SNIPPET_LENGTH = 20;

    private final int position;
    private final String remaining;

    public LexicalException(int position, String remaining) {
        super("Unexpected input at position " + position + ": \"" + snippet(remaining) + "\"");
        this.position = position;
        this.remaining = remaining;
    }

    public int getPosition() {
        return position;
    }

    /**
     * The unconsumed source starting at {@link #getPosition()}.
     */
    public String getRemaining() {
        return remaining;
    }

    private static String snippet(String text) {
        if (text.length() <= SNIPPET_LENGTH) {
            return text;
        }
        return text.substring(0, SNIPPET_LENGTH) + "...";
    }
}
