package com.arrowc.transform;

import com.arrowc.Parser;
import com.arrowc.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TraverserTest {

    // Records every callback as "hook:value:section"
    private static class RecordingVisitor implements AstVisitor {
        final List<String> events = new ArrayList<>();

        @Override
        public void enterProgram(Program program) {
            events.add("enter:Program");
        }

        @Override
        public void exitProgram(Program program) {
            events.add("exit:Program");
        }

        @Override
        public void enterFunction(FunctionNode function) {
            events.add("enter:Function");
        }

        @Override
        public void exitFunction(FunctionNode function) {
            events.add("exit:Function:" + function.params().size());
        }

        @Override
        public void visitStringLiteral(StringLiteral literal, Section section) {
            events.add("string:" + literal.value() + ":" + section);
        }

        @Override
        public void visitNumberLiteral(NumberLiteral literal, Section section) {
            events.add("number:" + literal.value() + ":" + section);
        }

        @Override
        public void visitOperator(Operator operator, Section section) {
            events.add("operator:" + operator.value() + ":" + section);
        }
    }

    @Test
    void testPreOrderParamsBeforeBody() {
        RecordingVisitor visitor = new RecordingVisitor();
        new Traverser(visitor).traverse(Parser.parse("(a, b) => a - 3"));

        assertEquals(List.of(
            "enter:Program",
            "enter:Function",
            "string:a:PARAMS",
            "string:b:PARAMS",
            "string:a:BODY",
            "operator:-:BODY",
            "number:3:BODY",
            "exit:Function:2",
            "exit:Program"
        ), visitor.events);
    }

    @Test
    void testTopLevelLeavesHaveNoSection() {
        RecordingVisitor visitor = new RecordingVisitor();
        new Traverser(visitor).traverse(Parser.parse("x"));
        assertEquals(List.of("enter:Program", "string:x:null", "exit:Program"), visitor.events);
    }

    @Test
    void testDefaultHooksDoNothing() {
        AstVisitor silent = new AstVisitor() {};
        assertDoesNotThrow(() -> new Traverser(silent).traverse(Parser.parse("(a) => a (b) => 1")));
    }

    @Test
    void testNestedProgramIsRejected() {
        RecordingVisitor visitor = new RecordingVisitor();
        Program program = new Program(0, 20, List.of(
            new FunctionNode(0, 8, List.of(new StringLiteral(1, 2, "a")), List.of(new StringLiteral(7, 8, "a"))),
            new Program(9, 9, List.of())));

        TraversalException e = assertThrows(TraversalException.class, () -> new Traverser(visitor).traverse(program));
        assertEquals("TraversalError", e.getErrorType());
        assertEquals("program", e.getContext());
        assertFalse(visitor.events.contains("exit:Program"));
    }

    @Test
    void testProgramInParametersIsRejected() {
        Program program = new Program(0, 5, List.of(
            new FunctionNode(0, 5, List.of(new Program(1, 1, List.of())), List.of())));

        TraversalException e = assertThrows(TraversalException.class,
            () -> new Traverser(new AstVisitor() {}).traverse(program));
        assertEquals("function", e.getContext());
    }
}
