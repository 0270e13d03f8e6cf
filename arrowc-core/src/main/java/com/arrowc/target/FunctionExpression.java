package com.arrowc.target;

import java.util.List;

/**
 * Parameters are normally identifiers, but any leaf from the source parameter list is kept.
 */
public record FunctionExpression(
    List<Argument> params,
    BlockExpression body
) implements TargetNode {

    public FunctionExpression {
        params = List.copyOf(params);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
