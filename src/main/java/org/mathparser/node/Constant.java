package org.mathparser.node;

import java.util.Set;

/**
 * Constant leaf: always evaluates to {@code value}.
 */
public record Constant(double value) implements MathNode {

    public static final Constant ONE = new Constant(1);
    public static final Constant PI = new Constant(Math.PI);

    @Override
    public double compute(VariableValues values, CustomFunctions functions) {
        return value;
    }

    @Override
    public Set<String> getUsedVariables() {
        return Set.of();
    }

    @Override
    public Set<FunctionDefinition> getUsedFreeformFunctions() {
        return Set.of();
    }
}
