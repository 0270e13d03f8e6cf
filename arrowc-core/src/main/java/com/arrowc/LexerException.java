package com.arrowc;

/**
 * Thrown by the {@link Lexer} on a character it does not recognize or a malformed arrow.
 */
public class LexerException extends ParseException {
    private final int position;
    private final String offending;

    public LexerException(String message, int position, String offending) {
        super("SyntaxError", null, null, null, message + " at position " + position);
        this.position = position;
        this.offending = offending;
    }

    public int getPosition() {
        return position;
    }

    /**
     * The offending character, or an empty string when the input ended.
     */
    public String getOffending() {
        return offending;
    }
}
