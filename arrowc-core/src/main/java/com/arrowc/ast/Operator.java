package com.arrowc.ast;

public record Operator(
    int start,
    int end,
    String value
) implements Leaf {

    @Override
    public String type() {
        return "Operator";
    }
}
