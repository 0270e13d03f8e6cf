package com.arrowc.target;

/**
 * A parameter or a return operand. Rendered as its stored name.
 */
public sealed interface Argument extends TargetNode permits Identifier, Literal, OperatorLiteral {
    String name();
}
