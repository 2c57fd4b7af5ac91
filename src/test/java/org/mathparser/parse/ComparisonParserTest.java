package org.mathparser.parse;

import org.mathparser.error.BracketsNotClosedException;
import org.mathparser.error.CantProcessExpressionException;
import org.mathparser.error.ExpressionTooDeepException;
import org.mathparser.error.MissingOperatorOperandException;
import org.mathparser.node.BinaryOperation;
import org.mathparser.node.Constant;
import org.mathparser.node.MathComparison;
import org.mathparser.node.MathExpression;
import org.mathparser.node.MathNode;
import org.mathparser.node.UnaryOperation;
import org.mathparser.node.Variable;
import org.mathparser.node.VariableValues;
import org.junit.jupiter.api.*;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for equations and inequalities parsed by {@link MathParser#parseExtended}.
 */
@DisplayName("Comparison Parser Tests")
class ComparisonParserTest {

    // ==================== Equations ====================

    @Test
    @DisplayName("Chained equation that holds")
    void testChainedEquation() {
        // GIVEN: Three sides equal to 2 when x = 2
        MathExpression expression = MathParser.parseExtended("2x-x=8x/2x-x=2");

        // WHEN
        OptionalDouble result = expression.calc(VariableValues.x(2));

        // THEN
        assertInstanceOf(MathComparison.class, expression);
        assertEquals(OptionalDouble.of(2), result);
        assertEquals(OptionalDouble.of(1), ((MathComparison) expression).evaluate(VariableValues.x(2)));
    }

    @Test
    @DisplayName("Chained equation that doesn't hold")
    void testFailedEquation() {
        MathComparison comparison = (MathComparison) MathParser.parseExtended("2x-x=8x/2x-x=3");

        assertTrue(comparison.calc(VariableValues.x(2)).isEmpty());
        assertEquals(OptionalDouble.of(0), comparison.evaluate(VariableValues.x(2)));
    }

    @Test
    @DisplayName("Chains fold from the left")
    void testLeftFold() {
        MathExpression expression = MathParser.parseExtended("1=1=1");

        MathComparison inner = MathComparison.equation(new Constant(1), new Constant(1));
        assertEquals(MathComparison.equation(inner, new Constant(1)), expression);
    }

    @Test
    @DisplayName("Without comparison operators a plain node is returned")
    void testPlainExpression() {
        MathExpression expression = MathParser.parseExtended("2+2");

        assertInstanceOf(MathNode.class, expression);
        assertEquals(OptionalDouble.of(4), expression.calc(VariableValues.none()));
    }

    // ==================== Inequalities ====================

    @Test
    @DisplayName("Strict inequalities")
    void testStrictInequalities() {
        MathExpression greater = MathParser.parseExtended("x > 1");

        assertEquals(OptionalDouble.of(2), greater.calc(VariableValues.x(2)));
        assertEquals(OptionalDouble.of(1), greater.calc(VariableValues.x(0)));
        assertEquals(OptionalDouble.of(1), MathParser.parseExtended("1 < 2 < 3").calc(VariableValues.none()));
        assertEquals(OptionalDouble.of(1), MathParser.parseExtended("3<1").calc(VariableValues.none()));
    }

    @Test
    @DisplayName("Chained inequality compares the winning side of the inner one")
    void testChainedInequality() {
        MathComparison comparison = (MathComparison) MathParser.parseExtended("3>5>1");

        assertEquals(OptionalDouble.of(5), comparison.calc(VariableValues.none()));
        assertEquals(OptionalDouble.of(1), comparison.evaluate(VariableValues.none()));
    }

    @Test
    @DisplayName("Two-character operators are recognised")
    void testNonStrictInequalities() {
        MathComparison greaterOrEqual = (MathComparison) MathParser.parseExtended("x >= 2");
        MathComparison lessOrEqual = (MathComparison) MathParser.parseExtended("x<=1");

        assertEquals(MathComparison.Operator.GREATER_THAN_OR_EQUALS, greaterOrEqual.operator());
        assertEquals(OptionalDouble.of(2), greaterOrEqual.calc(VariableValues.x(2)));
        assertEquals(MathComparison.Operator.LESS_THAN_OR_EQUALS, lessOrEqual.operator());
        assertEquals(OptionalDouble.of(1), lessOrEqual.calc(VariableValues.x(2)));
        assertEquals(OptionalDouble.of(0), lessOrEqual.evaluate(VariableValues.x(2)));
    }

    // ==================== Options ====================

    @Test
    @DisplayName("Sides honour the negation option")
    void testMinusNegativeFunction() {
        ParserOptions options = ParserOptions.defaults().withMinusNegativeFunction(true);

        MathComparison comparison = (MathComparison) MathParser.parseExtended("x-1=0", options);

        assertEquals(BinaryOperation.add(new Variable("x"), UnaryOperation.negate(new Constant(1))), comparison.left());
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Comparison operator without a side")
    void testMissingSide() {
        assertEquals("=", assertThrows(MissingOperatorOperandException.class,
                () -> MathParser.parseExtended("=2")).getOperator());
        assertEquals("=", assertThrows(MissingOperatorOperandException.class,
                () -> MathParser.parseExtended("2=")).getOperator());
        assertThrows(MissingOperatorOperandException.class, () -> MathParser.parseExtended("2==2"));
        assertThrows(MissingOperatorOperandException.class, () -> MathParser.parseExtended("2 = < 3"));
    }

    @Test
    @DisplayName("Overlong comparison chain is rejected")
    void testLongComparisonChain() {
        ExpressionTooDeepException e = assertThrows(ExpressionTooDeepException.class,
                () -> MathParser.parseExtended("1<".repeat(100_000) + "1"));

        assertEquals(2 * ParserOptions.DEFAULT_MAX_TREE_DEPTH + 1, e.getPosition());
    }

    @Test
    @DisplayName("Operators inside brackets don't split")
    void testBracketedOperator() {
        assertThrows(CantProcessExpressionException.class, () -> MathParser.parseExtended("(1<2)"));
    }

    @Test
    @DisplayName("Errors in a side report absolute positions")
    void testSidePositions() {
        BracketsNotClosedException e = assertThrows(BracketsNotClosedException.class,
                () -> MathParser.parseExtended("x = (2"));

        assertEquals(4, e.getStartPosition());
        assertEquals(6, e.getEndPosition());
    }

    @Test
    @DisplayName("Plain parse rejects comparison operators")
    void testPlainParseRejectsComparison() {
        assertThrows(CantProcessExpressionException.class, () -> MathParser.parse("x=1"));
    }
}
