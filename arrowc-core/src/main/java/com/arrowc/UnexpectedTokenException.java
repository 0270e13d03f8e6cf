package com.arrowc;

/**
 * Thrown when the parser meets a token that cannot start or continue the construct it is in.
 */
public class UnexpectedTokenException extends ParseException {

    public UnexpectedTokenException(Token token, String context) {
        super("ParseError", token, null, context, "Invalid token found");
    }

    public UnexpectedTokenException(Token token, String message, String context) {
        super("ParseError", token, null, context, message);
    }
}
