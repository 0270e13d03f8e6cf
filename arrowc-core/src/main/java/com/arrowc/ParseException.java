package com.arrowc;

/**
 * Base class for every error raised while compiling an arrow function.
 *
 * <p>The {@code errorType} names the failing stage ({@code SyntaxError} for the lexer,
 * {@code ParseError} for the parser, {@code TraversalError} for the transformer and
 * {@code GenerationError} for the code generator). The first error aborts the whole
 * pipeline and reaches the caller unchanged.</p>
 */
public class ParseException extends RuntimeException {
    private final String errorType;
    private final Token token;
    private final TokenType expected;
    private final String context;

    public ParseException(String errorType, Token token, TokenType expected, String context, String message) {
        super(buildMessage(errorType, token, context, message));
        this.errorType = errorType;
        this.token = token;
        this.expected = expected;
        this.context = context;
    }

    private static String buildMessage(String errorType, Token token, String context, String message) {
        StringBuilder sb = new StringBuilder(errorType).append(": ").append(message);
        if (token != null) {
            sb.append(" (found ").append(token.type()).append(" '").append(token.lexeme())
              .append("' at position ").append(token.position()).append(")");
        }
        if (context != null) {
            sb.append(" in ").append(context);
        }
        return sb.toString();
    }

    public String getErrorType() {
        return errorType;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getExpected() {
        return expected;
    }

    public String getContext() {
        return context;
    }
}
