package org.mathparser.node;

import java.util.Objects;

/**
 * Declaration of a custom (freeform) function: its name and the range of
 * argument counts it accepts, optionally bundled with an implementation.
 *
 * Example: {@code FunctionDefinition.implemented("twice", 1, 1, (args, v, f) -> 2 * args.get(0).compute(v, f))}
 *
 * @param name           The function name (case-sensitive)
 * @param minArgs        Minimum number of arguments
 * @param maxArgs        Maximum number of arguments
 * @param implementation The body, or null when it is supplied at evaluation time
 */
public record FunctionDefinition(
        String name,
        int minArgs,
        int maxArgs,
        FunctionImplementation implementation) {

    public FunctionDefinition {
        Objects.requireNonNull(name, "Function name cannot be null");
    }

    /**
     * Declares a function whose implementation is provided when the expression is evaluated.
     */
    public static FunctionDefinition declared(String name, int minArgs, int maxArgs) {
        return new FunctionDefinition(name, minArgs, maxArgs, null);
    }

    public static FunctionDefinition implemented(String name, int minArgs, int maxArgs,
            FunctionImplementation implementation) {
        Objects.requireNonNull(implementation, "Implementation cannot be null");
        return new FunctionDefinition(name, minArgs, maxArgs, implementation);
    }

    public boolean isImplemented() {
        return implementation != null;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    /**
     * Two definitions are compatible when they share name and argument range,
     * whatever their implementations are.
     */
    public boolean isCompatible(FunctionDefinition other) {
        return other != null
                && name.equals(other.name)
                && minArgs == other.minArgs
                && maxArgs == other.maxArgs;
    }

    @Override
    public String toString() {
        return name + "(" + minArgs + ":" + maxArgs + ")";
    }
}
