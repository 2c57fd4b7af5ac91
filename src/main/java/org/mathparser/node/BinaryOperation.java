package org.mathparser.node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;

/**
 * Two-operand operation: left op right (e.g., a + b, a ^ b).
 * For {@link Operator#LOG} the left operand is the base.
 */
public record BinaryOperation(Operator operator, MathNode left, MathNode right) implements MathNode {

    public enum Operator {
        ADD("+", (a, b) -> a + b),
        SUBTRACT("-", (a, b) -> a - b),
        MULTIPLY("*", (a, b) -> a * b),
        DIVIDE("/", (a, b) -> a / b),
        POWER("^", Math::pow),
        LOG("log", (base, x) -> Math.log(x) / Math.log(base));

        private final String symbol;
        private final DoubleBinaryOperator function;

        Operator(String symbol, DoubleBinaryOperator function) {
            this.symbol = symbol;
            this.function = function;
        }

        public String symbol() {
            return symbol;
        }

        public double apply(double left, double right) {
            return function.applyAsDouble(left, right);
        }
    }

    public BinaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryOperation add(MathNode left, MathNode right) {
        return new BinaryOperation(Operator.ADD, left, right);
    }

    public static BinaryOperation subtract(MathNode left, MathNode right) {
        return new BinaryOperation(Operator.SUBTRACT, left, right);
    }

    public static BinaryOperation multiply(MathNode left, MathNode right) {
        return new BinaryOperation(Operator.MULTIPLY, left, right);
    }

    public static BinaryOperation divide(MathNode left, MathNode right) {
        return new BinaryOperation(Operator.DIVIDE, left, right);
    }

    public static BinaryOperation power(MathNode base, MathNode exponent) {
        return new BinaryOperation(Operator.POWER, base, exponent);
    }

    public static BinaryOperation log(MathNode base, MathNode x) {
        return new BinaryOperation(Operator.LOG, base, x);
    }

    @Override
    public double compute(VariableValues values, CustomFunctions functions) {
        return operator.apply(left.compute(values, functions), right.compute(values, functions));
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
