package com.arrowc;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits arrow function source text into tokens.
 *
 * <p>Single forward pass, no backtracking. Numbers are runs of ASCII digits, identifiers are
 * runs of ASCII letters. Whitespace is skipped.</p>
 */
public class Lexer {
    private final char[] buf;
    private final int length;
    private int position = 0;

    public Lexer(String source) {
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (position < length) {
            int start = position;
            char c = buf[position++];

            switch (c) {
                case '(', ')' -> tokens.add(new Token(TokenType.PAREN, String.valueOf(c), start, position));
                case ',' -> tokens.add(new Token(TokenType.SEPARATOR, ",", start, position));
                case '+', '-', '*', '/' -> tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), start, position));
                case '=' -> tokens.add(scanArrow(start));
                case ' ', '\t', '\r', '\n' -> {
                    // whitespace
                }
                default -> {
                    if (isDigit(c)) {
                        tokens.add(scanNumber(start));
                    } else if (isLetter(c)) {
                        tokens.add(scanIdentifier(start));
                    } else {
                        throw new LexerException("Invalid symbol " + c, start, String.valueOf(c));
                    }
                }
            }
        }
        return tokens;
    }

    private Token scanArrow(int start) {
        if (position >= length) {
            throw new LexerException("'=' not followed by '>'", start, "");
        }
        char next = buf[position];
        if (next != '>') {
            throw new LexerException("'=' not followed by '>'", position, String.valueOf(next));
        }
        position++;
        return new Token(TokenType.ARROW, "=>", start, position);
    }

    private Token scanNumber(int start) {
        while (position < length && isDigit(buf[position])) {
            position++;
        }
        return new Token(TokenType.NUMBER, new String(buf, start, position - start), start, position);
    }

    private Token scanIdentifier(int start) {
        while (position < length && isLetter(buf[position])) {
            position++;
        }
        return new Token(TokenType.IDENTIFIER, new String(buf, start, position - start), start, position);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }
}
