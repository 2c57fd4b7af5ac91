package org.mathparser.node;

import java.util.Objects;
import java.util.Set;

/**
 * Variable leaf, replaced by its value from {@link VariableValues} when evaluated.
 *
 * @param name The variable name (case-sensitive)
 */
public record Variable(String name) implements MathNode {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }

    @Override
    public double compute(VariableValues values, CustomFunctions functions) {
        return values.get(name);
    }

    @Override
    public Set<String> getUsedVariables() {
        return Set.of(name);
    }

    @Override
    public Set<FunctionDefinition> getUsedFreeformFunctions() {
        return Set.of();
    }
}
