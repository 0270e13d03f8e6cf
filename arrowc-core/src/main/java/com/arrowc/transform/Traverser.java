package com.arrowc.transform;

import com.arrowc.ast.*;

import java.util.List;

/**
 * Depth-first, pre-order walk over a source tree.
 *
 * <p>A function's parameters are visited before its body. Exit hooks run after all children
 * of the node have been visited.</p>
 */
public final class Traverser {
    private final AstVisitor visitor;

    public Traverser(AstVisitor visitor) {
        this.visitor = visitor;
    }

    /**
     * Walks {@code program} as the root. A {@link Program} found anywhere below the root is
     * rejected with a {@link TraversalException}.
     */
    public void traverse(Program program) {
        if (program == null) {
            throw new TraversalException(null, "Unknown node null");
        }
        visitor.enterProgram(program);
        traverseChildren(program.body(), null);
        visitor.exitProgram(program);
    }

    private void traverseChildren(List<Node> children, Section section) {
        for (Node child : children) {
            traverseNode(child, section);
        }
    }

    private void traverseNode(Node node, Section section) {
        if (node instanceof Program program) {
            throw new TraversalException(section == null ? "program" : "function",
                "Program nested inside another node at position " + program.start());
        } else if (node instanceof FunctionNode function) {
            if (section != null) {
                throw new TraversalException("function", "Nested function at position " + function.start());
            }
            visitor.enterFunction(function);
            traverseChildren(function.params(), Section.PARAMS);
            traverseChildren(function.body(), Section.BODY);
            visitor.exitFunction(function);
        } else if (node instanceof StringLiteral literal) {
            visitor.visitStringLiteral(literal, section);
        } else if (node instanceof NumberLiteral literal) {
            visitor.visitNumberLiteral(literal, section);
        } else if (node instanceof Operator operator) {
            visitor.visitOperator(operator, section);
        } else {
            throw new TraversalException(null, "Unknown node " + (node == null ? "null" : node.type()));
        }
    }
}
