package com.arrowc.target;

public record Identifier(String name) implements Argument {
    @Override
    public String type() {
        return "Identifier";
    }
}
