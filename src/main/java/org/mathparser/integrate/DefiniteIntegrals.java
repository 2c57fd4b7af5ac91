package org.mathparser.integrate;

import org.mathparser.node.MathNode;
import org.mathparser.node.VariableValues;

import java.util.function.DoubleUnaryOperator;

/**
 * Numerical definite integrals of a parsed expression over one variable.
 *
 * The expression is evaluated at evenly spaced points between the limits;
 * {@code steps} is the number of sub-intervals. Variables other than the
 * integration variable must not appear in the expression.
 */
public final class DefiniteIntegrals {

    public static final String DEFAULT_VARIABLE = "x";

    private DefiniteIntegrals() {
    }

    public static double byLeftRectangles(MathNode node, int steps, double lowerLimit, double upperLimit) {
        return byLeftRectangles(node, DEFAULT_VARIABLE, steps, lowerLimit, upperLimit);
    }

    public static double byLeftRectangles(MathNode node, String variable, int steps,
            double lowerLimit, double upperLimit) {
        return rectangles(function(node, variable), steps, lowerLimit, upperLimit, 0);
    }

    public static double byRightRectangles(MathNode node, int steps, double lowerLimit, double upperLimit) {
        return byRightRectangles(node, DEFAULT_VARIABLE, steps, lowerLimit, upperLimit);
    }

    public static double byRightRectangles(MathNode node, String variable, int steps,
            double lowerLimit, double upperLimit) {
        return rectangles(function(node, variable), steps, lowerLimit, upperLimit, 1);
    }

    public static double byMiddleRectangles(MathNode node, int steps, double lowerLimit, double upperLimit) {
        return byMiddleRectangles(node, DEFAULT_VARIABLE, steps, lowerLimit, upperLimit);
    }

    public static double byMiddleRectangles(MathNode node, String variable, int steps,
            double lowerLimit, double upperLimit) {
        return rectangles(function(node, variable), steps, lowerLimit, upperLimit, 0.5);
    }

    public static double byTrapezoids(MathNode node, int steps, double lowerLimit, double upperLimit) {
        return byTrapezoids(node, DEFAULT_VARIABLE, steps, lowerLimit, upperLimit);
    }

    public static double byTrapezoids(MathNode node, String variable, int steps,
            double lowerLimit, double upperLimit) {
        checkSteps(steps);
        DoubleUnaryOperator f = function(node, variable);
        double step = (upperLimit - lowerLimit) / steps;

        double sum = (f.applyAsDouble(lowerLimit) + f.applyAsDouble(upperLimit)) / 2;
        for (int i = 1; i < steps; i++) {
            sum += f.applyAsDouble(lowerLimit + step * i);
        }
        return sum * step;
    }

    public static double bySimpson(MathNode node, int steps, double lowerLimit, double upperLimit) {
        return bySimpson(node, DEFAULT_VARIABLE, steps, lowerLimit, upperLimit);
    }

    /**
     * @throws IllegalArgumentException if {@code steps} isn't a positive even number
     */
    public static double bySimpson(MathNode node, String variable, int steps,
            double lowerLimit, double upperLimit) {
        checkSteps(steps);
        if (steps % 2 != 0) {
            throw new IllegalArgumentException("Simpson's rule needs an even number of steps, got: " + steps);
        }
        DoubleUnaryOperator f = function(node, variable);
        double step = (upperLimit - lowerLimit) / steps;

        double sum = f.applyAsDouble(lowerLimit) + f.applyAsDouble(upperLimit);
        for (int i = 1; i < steps; i++) {
            sum += (i % 2 == 1 ? 4 : 2) * f.applyAsDouble(lowerLimit + step * i);
        }
        return sum * step / 3;
    }

    /**
     * Sums rectangles whose height is taken at {@code position} (0 = left edge, 1 = right edge).
     */
    private static double rectangles(DoubleUnaryOperator f, int steps, double lowerLimit, double upperLimit,
            double position) {
        checkSteps(steps);
        double step = (upperLimit - lowerLimit) / steps;

        double sum = 0;
        for (int i = 0; i < steps; i++) {
            sum += f.applyAsDouble(lowerLimit + step * (i + position));
        }
        return sum * step;
    }

    private static DoubleUnaryOperator function(MathNode node, String variable) {
        return point -> node.compute(VariableValues.none().with(variable, point));
    }

    private static void checkSteps(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("Number of steps must be positive, got: " + steps);
        }
    }
}
