package com.arrowc.target;

import java.util.List;

public record BlockExpression(List<ReturnExpression> body) implements TargetNode {

    public BlockExpression {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "BlockExpression";
    }
}
