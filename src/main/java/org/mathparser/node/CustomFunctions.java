package org.mathparser.node;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.mathparser.error.UndefinedFunctionException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Immutable table of custom function definitions.
 *
 * Used twice: at parse time it declares which names are functions and how
 * many arguments they take; at evaluation time it supplies implementations
 * for definitions that weren't implemented when parsed.
 */
public final class CustomFunctions {

    private static final CustomFunctions NONE = new CustomFunctions(Lists.immutable.empty());

    private final ImmutableList<FunctionDefinition> definitions;

    private CustomFunctions(ImmutableList<FunctionDefinition> definitions) {
        this.definitions = definitions;
    }

    public static CustomFunctions none() {
        return NONE;
    }

    public static CustomFunctions of(FunctionDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static CustomFunctions of(Collection<FunctionDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return NONE;
        }
        return new CustomFunctions(Lists.immutable.withAll(definitions).distinct());
    }

    public List<FunctionDefinition> definitions() {
        return definitions.castToList();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    /**
     * Finds the first declared definition with the given name.
     */
    public Optional<FunctionDefinition> byName(String name) {
        return definitions.detectOptional(definition -> definition.name().equals(name));
    }

    /**
     * Finds the first definition compatible with {@code key}.
     *
     * @throws UndefinedFunctionException if there is none
     */
    public FunctionDefinition get(FunctionDefinition key) {
        return definitions.detectOptional(definition -> definition.isCompatible(key))
                .orElseThrow(() -> new UndefinedFunctionException(key.toString()));
    }

    /**
     * Finds the implementation of the first compatible, implemented definition.
     *
     * @throws UndefinedFunctionException if there is none
     */
    public FunctionImplementation implementationFor(FunctionDefinition key) {
        return definitions
                .detectOptional(definition -> definition.isCompatible(key) && definition.isImplemented())
                .map(FunctionDefinition::implementation)
                .orElseThrow(() -> new UndefinedFunctionException(key.toString()));
    }

    @Override
    public String toString() {
        return definitions.makeString("CustomFunctions[", ", ", "]");
    }
}
