package org.mathparser.node;

import java.util.OptionalDouble;

/**
 * An expression tree element that is guaranteed to evaluate to a number.
 * Nodes are immutable.
 */
public sealed interface MathNode extends MathExpression
        permits Constant, Variable, UnaryOperation, BinaryOperation, FreeformCall {

    /**
     * Evaluates the node.
     *
     * @throws org.mathparser.error.UndefinedVariableException if a used variable has no value
     * @throws org.mathparser.error.UndefinedFunctionException if a used custom function has no implementation
     */
    double compute(VariableValues values, CustomFunctions functions);

    default double compute(VariableValues values) {
        return compute(values, CustomFunctions.none());
    }

    @Override
    default OptionalDouble calc(VariableValues values, CustomFunctions functions) {
        return OptionalDouble.of(compute(values, functions));
    }
}
