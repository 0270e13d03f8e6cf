package com.arrowc.target;

import java.util.List;

public record TargetProgram(List<FunctionExpression> body) implements TargetNode {

    public TargetProgram {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Program";
    }
}
