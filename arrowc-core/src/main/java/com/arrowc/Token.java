package com.arrowc;

/**
 * A lexical token.
 *
 * @param type        the token type
 * @param lexeme      the source text of the token
 * @param position    offset of the first character in the source
 * @param endPosition offset just past the last character in the source
 */
public record Token(
    TokenType type,
    String lexeme,
    int position,
    int endPosition
) {
    public boolean opensParen() {
        return type == TokenType.PAREN && "(".equals(lexeme);
    }

    public boolean closesParen() {
        return type == TokenType.PAREN && ")".equals(lexeme);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + position;
    }
}
