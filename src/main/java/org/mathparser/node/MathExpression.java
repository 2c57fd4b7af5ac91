package org.mathparser.node;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Sealed interface representing anything that can be evaluated against
 * variable values.
 *
 * Type hierarchy:
 * MathExpression
 * ├── MathNode (always yields a number)
 * │   ├── Constant, Variable
 * │   ├── UnaryOperation (negation, trigonometry, natural exponent)
 * │   ├── BinaryOperation (arithmetic, power, logarithm)
 * │   └── FreeformCall (custom functions)
 * └── MathComparison (=, &lt;, &gt;, &lt;=, &gt;=; may yield no result)
 */
public sealed interface MathExpression permits MathNode, MathComparison {

    /**
     * Computes the most appropriate value for this expression.
     * A node always has a value; a comparison only has one when it holds.
     */
    OptionalDouble calc(VariableValues values, CustomFunctions functions);

    default OptionalDouble calc(VariableValues values) {
        return calc(values, CustomFunctions.none());
    }

    /**
     * Names of all variables that must have a value to evaluate the expression.
     */
    Set<String> getUsedVariables();

    /**
     * Definitions of all custom functions referenced by the expression.
     */
    Set<FunctionDefinition> getUsedFreeformFunctions();
}
