package org.mathparser.node;

import org.mathparser.error.OutOfRangeFunctionArgumentListException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Call of a custom function: name(arg1, arg2, ...)
 *
 * The argument count is checked against the definition on construction.
 * Evaluation uses the implementation bundled with the definition, or else the
 * first compatible implementation from the table passed to {@link #compute}.
 */
public record FreeformCall(FunctionDefinition definition, List<MathNode> arguments) implements MathNode {

    public FreeformCall {
        Objects.requireNonNull(definition, "Definition cannot be null");
        arguments = List.copyOf(arguments);
        if (!definition.acceptsArgumentCount(arguments.size())) {
            throw new OutOfRangeFunctionArgumentListException(definition.toString(), arguments.size());
        }
    }

    @Override
    public double compute(VariableValues values, CustomFunctions functions) {
        FunctionImplementation implementation = definition.isImplemented()
                ? definition.implementation()
                : functions.implementationFor(definition);
        return implementation.apply(arguments, values, functions);
    }

    @Override
    public Set<String> getUsedVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (MathNode argument : arguments) {
            names.addAll(argument.getUsedVariables());
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public Set<FunctionDefinition> getUsedFreeformFunctions() {
        Set<FunctionDefinition> definitions = new LinkedHashSet<>();
        definitions.add(definition);
        for (MathNode argument : arguments) {
            definitions.addAll(argument.getUsedFreeformFunctions());
        }
        return Collections.unmodifiableSet(definitions);
    }
}
