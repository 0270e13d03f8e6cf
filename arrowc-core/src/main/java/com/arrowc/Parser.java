package com.arrowc;

import com.arrowc.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for arrow functions.
 *
 * <p>Grammar, informally:</p>
 * <pre>
 * program   := entry*
 * entry     := leaf | ',' | function
 * function  := '(' (leaf | ',')* ')' ( '=>' (leaf | ',')* )?
 * leaf      := NUMBER | IDENTIFIER | OPERATOR
 * </pre>
 *
 * <p>An arrow body runs until the end of input or until the {@code (} that opens the next
 * sibling function. Nested or chained arrow functions are rejected.</p>
 *
 * <p>A parser instance owns its cursor and is used for a single parse.</p>
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    // The parameter list of a function whose arrow body has not been read yet
    private record ParameterList(Token open, List<Node> params, int end) {}

    public Parser(String source) {
        this(new Lexer(source).tokenize());
    }

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public Program parse() {
        List<Node> body = new ArrayList<>();
        while (!isAtEnd()) {
            Node node = parseEntry();
            if (node != null) {
                body.add(node);
            }
        }
        int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).endPosition();
        return new Program(0, end, body);
    }

    /**
     * Parse one top-level entry. Returns null for entries that produce no node (separators).
     */
    private Node parseEntry() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER, IDENTIFIER, OPERATOR -> parseLeaf();
            case SEPARATOR -> {
                advance();
                yield null;
            }
            case PAREN -> {
                if (!token.opensParen()) {
                    throw new UnexpectedTokenException(token, "Unmatched ')'", "program");
                }
                yield parseFunction();
            }
            case ARROW -> throw new UnexpectedTokenException(token, "'=>' must follow a parameter list", "program");
        };
    }

    private FunctionNode parseFunction() {
        ParameterList parameterList = parseParameterList();
        if (check(TokenType.ARROW)) {
            advance();
            return parseArrowBody(parameterList);
        }
        return new FunctionNode(parameterList.open().position(), parameterList.end(),
                                parameterList.params(), List.of());
    }

    private ParameterList parseParameterList() {
        Token open = advance();
        List<Node> params = new ArrayList<>();

        while (true) {
            if (isAtEnd()) {
                throw new ExpectedTokenException(
                    "Expected ')' to close the parameter list opened at position " + open.position()
                        + " but reached end of input",
                    TokenType.PAREN, previous());
            }
            Token token = peek();
            if (token.closesParen()) {
                advance();
                return new ParameterList(open, params, token.endPosition());
            }
            switch (token.type()) {
                case NUMBER, IDENTIFIER, OPERATOR -> params.add(parseLeaf());
                case SEPARATOR -> advance();
                case PAREN -> throw new UnexpectedTokenException(token, "Nested parameter lists are not supported", "parameter list");
                case ARROW -> throw new ExpectedTokenException(
                    "Expected ')' to close the parameter list opened at position " + open.position()
                        + " before '=>'",
                    TokenType.PAREN, token);
            }
        }
    }

    private FunctionNode parseArrowBody(ParameterList parameterList) {
        List<Node> body = new ArrayList<>();
        int end = previous().endPosition();

        while (!isAtEnd() && !peek().opensParen()) {
            Token token = peek();
            switch (token.type()) {
                case NUMBER, IDENTIFIER, OPERATOR -> {
                    Leaf leaf = parseLeaf();
                    body.add(leaf);
                    end = leaf.end();
                }
                case SEPARATOR -> advance();
                case PAREN -> throw new UnexpectedTokenException(token, "Unmatched ')'", "arrow function body");
                case ARROW -> throw new UnexpectedTokenException(token, "Chained arrow functions are not supported", "arrow function body");
            }
        }
        return new FunctionNode(parameterList.open().position(), end, parameterList.params(), body);
    }

    private Leaf parseLeaf() {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> new NumberLiteral(token.position(), token.endPosition(), token.lexeme());
            case IDENTIFIER -> new StringLiteral(token.position(), token.endPosition(), token.lexeme());
            case OPERATOR -> new Operator(token.position(), token.endPosition(), token.lexeme());
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    // Helper methods

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return current == 0 ? null : tokens.get(current - 1);
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }
}
