package com.arrowc.ast;

/**
 * A node that carries the text of a single token and has no children.
 */
public sealed interface Leaf extends Node permits NumberLiteral, StringLiteral, Operator {
    String value();
}
