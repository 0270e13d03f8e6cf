package com.arrowc.target;

import java.util.List;

/**
 * A return statement whose operands are emitted flat, in source order.
 */
public record ReturnExpression(List<Argument> arguments) implements TargetNode {

    public ReturnExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "ReturnExpression";
    }
}
