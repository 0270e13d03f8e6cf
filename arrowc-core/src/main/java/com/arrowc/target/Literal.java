package com.arrowc.target;

public record Literal(String name) implements Argument {
    @Override
    public String type() {
        return "Literal";
    }
}
