package com.arrowc;

/**
 * Thrown when a required token is missing, typically because the input ended early.
 * The token is the last one read, or {@code null} when the input held no tokens at all.
 */
public class ExpectedTokenException extends ParseException {

    public ExpectedTokenException(String message, TokenType expected, Token lastToken) {
        super("ParseError", lastToken, expected, null, message);
    }
}
