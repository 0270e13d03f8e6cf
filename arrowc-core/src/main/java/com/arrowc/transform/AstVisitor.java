package com.arrowc.transform;

import com.arrowc.ast.FunctionNode;
import com.arrowc.ast.NumberLiteral;
import com.arrowc.ast.Operator;
import com.arrowc.ast.Program;
import com.arrowc.ast.StringLiteral;

/**
 * Callbacks invoked by {@link Traverser}. All hooks default to doing nothing.
 *
 * <p>Leaf hooks receive the section of the enclosing function, or {@code null} when the
 * leaf sits directly in the program body.</p>
 */
public interface AstVisitor {

    default void enterProgram(Program program) {}

    default void exitProgram(Program program) {}

    default void enterFunction(FunctionNode function) {}

    default void exitFunction(FunctionNode function) {}

    default void visitStringLiteral(StringLiteral literal, Section section) {}

    default void visitNumberLiteral(NumberLiteral literal, Section section) {}

    default void visitOperator(Operator operator, Section section) {}
}
