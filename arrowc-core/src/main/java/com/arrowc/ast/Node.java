package com.arrowc.ast;

/**
 * Base interface for all source AST nodes
 */
public sealed interface Node permits
    Program,
    FunctionNode,
    Leaf {

    String type();
    int start();
    int end();
}
