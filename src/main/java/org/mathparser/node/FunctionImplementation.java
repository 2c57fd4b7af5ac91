package org.mathparser.node;

import java.util.List;

/**
 * Body of a custom function. Receives the unevaluated argument nodes so an
 * implementation decides itself which arguments to compute and how.
 */
@FunctionalInterface
public interface FunctionImplementation {

    double apply(List<MathNode> arguments, VariableValues values, CustomFunctions functions);
}
