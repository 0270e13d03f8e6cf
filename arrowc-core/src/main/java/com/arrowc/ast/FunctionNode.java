package com.arrowc.ast;

import java.util.List;

/**
 * A parenthesized parameter list together with the body that follows its arrow.
 * The body is empty when the parameter list was not followed by {@code =>}.
 */
public record FunctionNode(
    int start,
    int end,
    List<Node> params,
    List<Node> body
) implements Node {

    public FunctionNode {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Function";
    }
}
