package org.mathparser.node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Represents a comparison between two expressions.
 *
 * Example: 2x = 4, x &gt; 1, x &lt;= y
 *
 * Comparisons chain left to right, so {@code a = b = c} is
 * {@code (a = b) = c}: the inner comparison's {@link #calc} is the left value
 * of the outer one. {@code 3 > 5 > 1} is therefore {@code 5 > 1}.
 *
 * @param left     The left operand
 * @param operator The comparison operator
 * @param right    The right operand
 */
public record MathComparison(
        MathExpression left,
        Operator operator,
        MathExpression right) implements MathExpression {

    public enum Operator {
        EQUALS("="),
        GREATER_THAN(">"),
        LESS_THAN("<"),
        GREATER_THAN_OR_EQUALS(">="),
        LESS_THAN_OR_EQUALS("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(double left, double right) {
            return switch (this) {
                case EQUALS -> left == right;
                case GREATER_THAN -> left > right;
                case LESS_THAN -> left < right;
                case GREATER_THAN_OR_EQUALS -> left >= right;
                case LESS_THAN_OR_EQUALS -> left <= right;
            };
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown operator: " + symbol);
        }
    }

    public MathComparison {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static MathComparison equation(MathExpression left, MathExpression right) {
        return new MathComparison(left, Operator.EQUALS, right);
    }

    /**
     * Returns the most appropriate value of the comparison. An equation yields
     * the value shared by both sides, or no result when the sides differ. An
     * inequality yields its winning side: the left value when the relation
     * holds, the right value otherwise.
     */
    @Override
    public OptionalDouble calc(VariableValues values, CustomFunctions functions) {
        OptionalDouble leftResult = left.calc(values, functions);
        if (leftResult.isEmpty()) {
            return OptionalDouble.empty();
        }
        OptionalDouble rightResult = right.calc(values, functions);
        if (rightResult.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (operator.test(leftResult.getAsDouble(), rightResult.getAsDouble())) {
            return leftResult;
        }
        return operator == Operator.EQUALS ? OptionalDouble.empty() : rightResult;
    }

    /**
     * Returns 1 when the comparison holds and 0 when it doesn't; no result if
     * either side has none.
     */
    public OptionalDouble evaluate(VariableValues values, CustomFunctions functions) {
        OptionalDouble leftResult = left.calc(values, functions);
        if (leftResult.isEmpty()) {
            return OptionalDouble.empty();
        }
        OptionalDouble rightResult = right.calc(values, functions);
        if (rightResult.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(operator.test(leftResult.getAsDouble(), rightResult.getAsDouble()) ? 1 : 0);
    }

    public OptionalDouble evaluate(VariableValues values) {
        return evaluate(values, CustomFunctions.none());
    }

    @Override
    public Set<String> getUsedVariables() {
        Set<String> names = new LinkedHashSet<>(left.getUsedVariables());
        names.addAll(right.getUsedVariables());
        return Collections.unmodifiableSet(names);
    }

    @Override
    public Set<FunctionDefinition> getUsedFreeformFunctions() {
        Set<FunctionDefinition> definitions = new LinkedHashSet<>(left.getUsedFreeformFunctions());
        definitions.addAll(right.getUsedFreeformFunctions());
        return Collections.unmodifiableSet(definitions);
    }
}
