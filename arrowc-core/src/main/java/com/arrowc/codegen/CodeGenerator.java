package com.arrowc.codegen;

import com.arrowc.target.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a function expression tree as source text.
 *
 * <pre>
 * function (x, y) {
 * 	return x + y
 * }
 * </pre>
 *
 * Operands are written flat and space separated; no grouping is added.
 */
public class CodeGenerator {
    public static final String DEFAULT_INDENT = "\t";

    private final String indent;

    public CodeGenerator() {
        this(DEFAULT_INDENT);
    }

    public CodeGenerator(String indent) {
        this.indent = indent;
    }

    public String generate(TargetNode node) {
        if (node instanceof TargetProgram program) {
            return join(program.body(), "\n");
        } else if (node instanceof FunctionExpression function) {
            return "function (" + join(function.params(), ", ") + ") " + generate(function.body());
        } else if (node instanceof BlockExpression block) {
            return "{\n" + join(block.body(), "\n") + "}\n";
        } else if (node instanceof ReturnExpression ret) {
            return indent + "return " + join(ret.arguments(), " ") + "\n";
        } else if (node instanceof Argument argument) {
            return argument.name();
        }
        throw new GenerationException("Invalid type " + (node == null ? "null" : node.type()));
    }

    private String join(List<? extends TargetNode> nodes, String separator) {
        return nodes.stream().map(this::generate).collect(Collectors.joining(separator));
    }
}
