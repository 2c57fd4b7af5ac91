package org.mathparser.node;

import org.mathparser.error.UndefinedVariableException;

import java.util.HashMap;
import java.util.Map;

/**
 * Immutable variable name to value bindings used when evaluating an expression.
 */
public final class VariableValues {

    private static final VariableValues NONE = new VariableValues(Map.of());

    private final Map<String, Double> values;

    private VariableValues(Map<String, Double> values) {
        this.values = values;
    }

    /**
     * Bindings for expressions without variables.
     */
    public static VariableValues none() {
        return NONE;
    }

    public static VariableValues x(double x) {
        return new VariableValues(Map.of("x", x));
    }

    public static VariableValues of(Map<String, ? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        Map<String, Double> copy = new HashMap<>();
        values.forEach((name, value) -> copy.put(name, value.doubleValue()));
        return new VariableValues(Map.copyOf(copy));
    }

    /**
     * Returns a copy with {@code name} bound to {@code value}.
     */
    public VariableValues with(String name, double value) {
        Map<String, Double> copy = new HashMap<>(values);
        copy.put(name, value);
        return new VariableValues(Map.copyOf(copy));
    }

    /**
     * @throws UndefinedVariableException if {@code name} has no value
     */
    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new UndefinedVariableException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "VariableValues" + values;
    }
}
