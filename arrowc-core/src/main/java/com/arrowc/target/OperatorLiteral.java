package com.arrowc.target;

public record OperatorLiteral(String name) implements Argument {
    @Override
    public String type() {
        return "OperatorLiteral";
    }
}
