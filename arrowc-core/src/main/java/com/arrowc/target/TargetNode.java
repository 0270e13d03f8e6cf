package com.arrowc.target;

/**
 * Base interface for all nodes of the generated function tree
 */
public sealed interface TargetNode permits
    TargetProgram,
    FunctionExpression,
    BlockExpression,
    ReturnExpression,
    Argument {

    String type();
}
