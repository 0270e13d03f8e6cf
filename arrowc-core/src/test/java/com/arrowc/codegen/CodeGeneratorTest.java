package com.arrowc.codegen;

import com.arrowc.target.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static FunctionExpression function(List<Argument> params, List<Argument> returned) {
        return new FunctionExpression(params,
            new BlockExpression(List.of(new ReturnExpression(returned))));
    }

    @Test
    void testLeaves() {
        CodeGenerator generator = new CodeGenerator();
        assertEquals("x", generator.generate(new Identifier("x")));
        assertEquals("42", generator.generate(new Literal("42")));
        assertEquals("*", generator.generate(new OperatorLiteral("*")));
    }

    @Test
    void testReturnExpression() {
        String out = new CodeGenerator().generate(
            new ReturnExpression(List.of(new Identifier("a"), new OperatorLiteral("/"), new Literal("2"))));
        assertEquals("\treturn a / 2\n", out);
    }

    @Test
    void testFunctionExpression() {
        FunctionExpression fn = function(
            List.of(new Identifier("x"), new Identifier("y")),
            List.of(new Identifier("x"), new OperatorLiteral("+"), new Identifier("y")));

        String expected = """
            function (x, y) {
            \treturn x + y
            }
            """;
        assertEquals(expected, new CodeGenerator().generate(fn));
    }

    @Test
    void testBlockWithSeveralStatements() {
        BlockExpression block = new BlockExpression(List.of(
            new ReturnExpression(List.of(new Identifier("a"))),
            new ReturnExpression(List.of(new Identifier("b")))));
        assertEquals("{\n\treturn a\n\n\treturn b\n}\n", new CodeGenerator().generate(block));
    }

    @Test
    void testProgramJoinsFunctionsWithNewline() {
        TargetProgram program = new TargetProgram(List.of(
            function(List.of(), List.of(new Literal("1"))),
            function(List.of(), List.of(new Literal("2")))));
        assertEquals("function () {\n\treturn 1\n}\n\nfunction () {\n\treturn 2\n}\n",
            new CodeGenerator().generate(program));
        assertEquals("", new CodeGenerator().generate(new TargetProgram(List.of())));
    }

    @Test
    void testIndent() {
        assertEquals("  return n\n",
            new CodeGenerator("  ").generate(new ReturnExpression(List.of(new Identifier("n")))));
    }

    @Test
    void testNullNodeIsGenerationError() {
        GenerationException e = assertThrows(GenerationException.class, () -> new CodeGenerator().generate(null));
        assertEquals("GenerationError", e.getErrorType());
    }
}
