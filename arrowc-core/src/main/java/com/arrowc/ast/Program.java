package com.arrowc.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    List<Node> body
) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Program";
    }
}
