package com.arrowc.transform;

import com.arrowc.Parser;
import com.arrowc.ast.*;
import com.arrowc.target.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformerTest {

    @Test
    void testFunctionShape() {
        TargetProgram target = Transformer.transformProgram(Parser.parse("(x, y) => x + y"));

        assertEquals("Program", target.type());
        assertEquals(1, target.body().size());

        FunctionExpression function = target.body().get(0);
        assertEquals(List.of(new Identifier("x"), new Identifier("y")), function.params());
        assertEquals(1, function.body().body().size());

        ReturnExpression ret = function.body().body().get(0);
        assertEquals(List.of(new Identifier("x"), new OperatorLiteral("+"), new Identifier("y")), ret.arguments());
    }

    @Test
    void testLeafMapping() {
        TargetProgram target = new Transformer().transform(Parser.parse("(n) => n * 10"));
        List<Argument> arguments = target.body().get(0).body().body().get(0).arguments();

        assertEquals("Identifier", arguments.get(0).type());
        assertEquals("OperatorLiteral", arguments.get(1).type());
        assertEquals(new Literal("10"), arguments.get(2));
        assertEquals("Literal", arguments.get(2).type());
    }

    @Test
    void testEmptyBodyStillHasOneReturn() {
        TargetProgram target = Transformer.transformProgram(Parser.parse("(a)"));
        BlockExpression block = target.body().get(0).body();
        assertEquals(1, block.body().size());
        assertTrue(block.body().get(0).arguments().isEmpty());
    }

    @Test
    void testSiblingFunctionsDoNotShareState() {
        TargetProgram target = Transformer.transformProgram(Parser.parse("(a) => a (b, c) => b + c"));

        assertEquals(2, target.body().size());
        FunctionExpression first = target.body().get(0);
        FunctionExpression second = target.body().get(1);

        assertEquals(List.of(new Identifier("a")), first.params());
        assertEquals(List.of(new Identifier("a")), first.body().body().get(0).arguments());
        assertEquals(List.of(new Identifier("b"), new Identifier("c")), second.params());
        assertEquals(3, second.body().body().get(0).arguments().size());
    }

    @Test
    void testNonIdentifierParametersAreKept() {
        TargetProgram target = Transformer.transformProgram(Parser.parse("(x, 1) => x"));
        assertEquals(List.of(new Identifier("x"), new Literal("1")), target.body().get(0).params());
    }

    @Test
    void testLeafOutsideFunction() {
        Program program = new Program(0, 1, List.of(new StringLiteral(0, 1, "x")));
        TraversalException e = assertThrows(TraversalException.class, () -> Transformer.transformProgram(program));
        assertEquals("program", e.getContext());
    }

    @Test
    void testNestedFunctionIsRejected() {
        FunctionNode inner = new FunctionNode(1, 3, List.of(), List.of());
        Program program = new Program(0, 4, List.of(new FunctionNode(0, 4, List.of(inner), List.of())));
        assertThrows(TraversalException.class, () -> Transformer.transformProgram(program));
    }

    @Test
    void testTransformerIsSingleUse() {
        Transformer transformer = new Transformer();
        transformer.transform(Parser.parse("(a) => a"));
        assertThrows(IllegalStateException.class, () -> transformer.transform(Parser.parse("(b) => b")));
    }

    @Test
    void testTargetTreeIsImmutable() {
        TargetProgram target = Transformer.transformProgram(Parser.parse("(a) => a"));
        assertThrows(UnsupportedOperationException.class, () -> target.body().clear());
        assertThrows(UnsupportedOperationException.class,
            () -> target.body().get(0).params().add(new Identifier("z")));
    }

    @Test
    void testNestedProgramDoesNotDropLoweredFunctions() {
        Program program = new Program(0, 20, List.of(
            new FunctionNode(0, 8, List.of(new StringLiteral(1, 2, "a")), List.of(new StringLiteral(7, 8, "a"))),
            new Program(9, 9, List.of()),
            new FunctionNode(10, 18, List.of(new StringLiteral(11, 12, "b")), List.of(new StringLiteral(17, 18, "b")))));

        TraversalException e = assertThrows(TraversalException.class, () -> Transformer.transformProgram(program));
        assertEquals("TraversalError", e.getErrorType());
    }
}
