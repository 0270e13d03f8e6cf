package com.arrowc.ast;

/**
 * An identifier-like token such as a parameter or variable name.
 */
public record StringLiteral(
    int start,
    int end,
    String value
) implements Leaf {

    @Override
    public String type() {
        return "StringLiteral";
    }
}
