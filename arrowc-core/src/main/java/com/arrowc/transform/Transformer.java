package com.arrowc.transform;

import com.arrowc.ast.FunctionNode;
import com.arrowc.ast.NumberLiteral;
import com.arrowc.ast.Operator;
import com.arrowc.ast.Program;
import com.arrowc.ast.StringLiteral;
import com.arrowc.target.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a parsed arrow function tree into a function expression tree.
 *
 * <p>Each source function becomes a {@link FunctionExpression} whose body is a block holding
 * exactly one {@link ReturnExpression}. Leaves found in the parameter list become the
 * parameters; leaves found in the arrow body become the return operands, in order.</p>
 *
 * <p>A transformer instance is used for a single transformation.</p>
 */
public class Transformer implements AstVisitor {
    private final List<FunctionExpression> functions = new ArrayList<>();
    private FunctionFrame open;
    private TargetProgram result;

    /**
     * The function expression under construction.
     */
    private static final class FunctionFrame {
        final FunctionNode source;
        final List<Argument> params = new ArrayList<>();
        final List<Argument> returnArguments = new ArrayList<>();

        FunctionFrame(FunctionNode source) {
            this.source = source;
        }

        void append(Section section, Argument argument) {
            switch (section) {
                case PARAMS -> params.add(argument);
                case BODY -> returnArguments.add(argument);
            }
        }

        FunctionExpression close() {
            ReturnExpression ret = new ReturnExpression(returnArguments);
            return new FunctionExpression(params, new BlockExpression(List.of(ret)));
        }
    }

    public TargetProgram transform(Program program) {
        if (result != null) {
            throw new IllegalStateException("Transformer instances cannot be reused");
        }
        new Traverser(this).traverse(program);
        return result;
    }

    @Override
    public void enterProgram(Program program) {
        functions.clear();
    }

    @Override
    public void exitProgram(Program program) {
        result = new TargetProgram(functions);
    }

    @Override
    public void enterFunction(FunctionNode function) {
        open = new FunctionFrame(function);
    }

    @Override
    public void exitFunction(FunctionNode function) {
        if (open == null || open.source != function) {
            throw new TraversalException("function", "Exited a function that was never entered");
        }
        functions.add(open.close());
        open = null;
    }

    @Override
    public void visitStringLiteral(StringLiteral literal, Section section) {
        appendToOpenFunction(new Identifier(literal.value()), section, literal.start());
    }

    @Override
    public void visitNumberLiteral(NumberLiteral literal, Section section) {
        appendToOpenFunction(new Literal(literal.value()), section, literal.start());
    }

    @Override
    public void visitOperator(Operator operator, Section section) {
        appendToOpenFunction(new OperatorLiteral(operator.value()), section, operator.start());
    }

    private void appendToOpenFunction(Argument argument, Section section, int position) {
        if (section == null || open == null) {
            throw new TraversalException("program",
                "Unexpected function section: '" + argument.name() + "' at position " + position
                    + " is not inside a function");
        }
        open.append(section, argument);
    }

    public static TargetProgram transformProgram(Program program) {
        return new Transformer().transform(program);
    }
}
