package org.mathparser.node;

import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Single-operand operation: negation, trigonometric functions and the natural exponent.
 */
public record UnaryOperation(Operator operator, MathNode operand) implements MathNode {

    public enum Operator {
        NEGATE(x -> -x),
        SIN(Math::sin),
        COS(Math::cos),
        TAN(Math::tan),
        COT(x -> 1 / Math.tan(x)),
        ASIN(Math::asin),
        ACOS(Math::acos),
        ATAN(Math::atan),
        ACOT(x -> Math.atan(1 / x)),
        EXP(Math::exp);

        private final DoubleUnaryOperator function;

        Operator(DoubleUnaryOperator function) {
            this.function = function;
        }

        public double apply(double x) {
            return function.applyAsDouble(x);
        }
    }

    public UnaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public static UnaryOperation negate(MathNode operand) {
        return new UnaryOperation(Operator.NEGATE, operand);
    }

    /**
     * e raised to {@code exponent}.
     */
    public static UnaryOperation naturalExp(MathNode exponent) {
        return new UnaryOperation(Operator.EXP, exponent);
    }

    /**
     * The constant e, expressed as e^1.
     */
    public static UnaryOperation e() {
        return naturalExp(Constant.ONE);
    }

    /**
     * True for the constant e, which the power operator folds into its exponent.
     */
    public boolean isEulerConstant() {
        return operator == Operator.EXP && Constant.ONE.equals(operand);
    }

    @Override
    public double compute(VariableValues values, CustomFunctions functions) {
        return operator.apply(operand.compute(values, functions));
    }

    @Override
    public Set<String> getUsedVariables() {
        return operand.getUsedVariables();
    }

    @Override
    public Set<FunctionDefinition> getUsedFreeformFunctions() {
        return operand.getUsedFreeformFunctions();
    }
}
