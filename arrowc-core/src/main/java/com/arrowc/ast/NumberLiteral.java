package com.arrowc.ast;

public record NumberLiteral(
    int start,
    int end,
    String value
) implements Leaf {

    @Override
    public String type() {
        return "NumberLiteral";
    }
}
