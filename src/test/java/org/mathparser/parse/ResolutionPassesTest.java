package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.mathparser.error.CantProcessExpressionException;
import org.mathparser.error.MissingOperatorOperandException;
import org.mathparser.node.BinaryOperation;
import org.mathparser.node.Constant;
import org.mathparser.node.CustomFunctions;
import org.mathparser.node.MathNode;
import org.mathparser.node.UnaryOperation;
import org.mathparser.node.Variable;
import org.junit.jupiter.api.*;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the individual passes, fed with hand-built part sequences.
 */
@DisplayName("Resolution Passes Tests")
class ResolutionPassesTest {

    private static final Constant TWO = new Constant(2);
    private static final Constant THREE = new Constant(3);

    private static Part text(String text) {
        return new Part.Text(text);
    }

    private static Part node(MathNode node) {
        return new Part.Resolved(node);
    }

    @Test
    @DisplayName("Declared variables win over constants")
    void testSubstituteVariables() {
        ImmutableList<Part> parts = Lists.immutable.of(text("x"), text("e"), text("pi"), text("π"), text("y"));

        ImmutableList<Part> result = ResolutionPasses.substituteVariables(parts, Set.of("x"));

        assertEquals(Lists.immutable.of(
                node(new Variable("x")),
                node(UnaryOperation.e()),
                node(Constant.PI),
                node(Constant.PI),
                text("y")), result);
    }

    @Test
    @DisplayName("Built-in function consumes the argument list after it")
    void testApplyFunctions() {
        ImmutableList<Part> parts = Lists.immutable.of(
                text("log"), new Part.Arguments(Lists.immutable.of(TWO, new Constant(8))), text("+"), node(THREE));

        ImmutableList<Part> result = ResolutionPasses.applyFunctions(parts, CustomFunctions.none());

        assertEquals(Lists.immutable.of(
                node(BinaryOperation.log(TWO, new Constant(8))), text("+"), node(THREE)), result);
    }

    @Test
    @DisplayName("Minus is unary at the start and after an operator")
    void testApplyUnaryMinus() {
        ImmutableList<Part> parts = Lists.immutable.of(text("-"), node(TWO), text("*"), text("-"), node(THREE));

        ImmutableList<Part> result = ResolutionPasses.applyUnaryMinus(parts);

        assertEquals(Lists.immutable.of(
                node(UnaryOperation.negate(TWO)), text("*"), node(UnaryOperation.negate(THREE))), result);
    }

    @Test
    @DisplayName("Minus between operands stays binary")
    void testBinaryMinusUntouched() {
        ImmutableList<Part> parts = Lists.immutable.of(node(TWO), text("-"), node(THREE));

        assertEquals(parts, ResolutionPasses.applyUnaryMinus(parts));
    }

    @Test
    @DisplayName("Power folds left to right and specialises e")
    void testApplyPower() {
        Variable x = new Variable("x");

        assertEquals(Lists.immutable.of(node(UnaryOperation.naturalExp(x))),
                ResolutionPasses.applyPower(Lists.immutable.of(node(UnaryOperation.e()), text("^"), node(x))));
        assertEquals(Lists.immutable.of(node(BinaryOperation.power(BinaryOperation.power(TWO, THREE), x))),
                ResolutionPasses.applyPower(Lists.immutable.of(node(TWO), text("^"), node(THREE), text("^"), node(x))));
    }

    @Test
    @DisplayName("Adjacent nodes are multiplied")
    void testApplyImplicitMultiplication() {
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        Variable c = new Variable("c");

        ImmutableList<Part> result = ResolutionPasses.applyImplicitMultiplication(
                Lists.immutable.of(node(a), node(b), node(c), text("+"), node(TWO), node(THREE)));

        assertEquals(Lists.immutable.of(
                node(BinaryOperation.multiply(BinaryOperation.multiply(a, b), c)),
                text("+"),
                node(BinaryOperation.multiply(TWO, THREE))), result);
    }

    @Test
    @DisplayName("Division and multiplication share a level")
    void testApplyMultiplicative() {
        Constant eight = new Constant(8);

        ImmutableList<Part> result = ResolutionPasses.applyMultiplicative(
                Lists.immutable.of(node(eight), text("/"), node(TWO), text("*"), node(THREE)));

        assertEquals(Lists.immutable.of(
                node(BinaryOperation.multiply(BinaryOperation.divide(eight, TWO), THREE))), result);
    }

    @Test
    @DisplayName("Subtraction with and without negation rewrite")
    void testApplyAdditive() {
        ImmutableList<Part> parts = Lists.immutable.of(node(TWO), text("-"), node(THREE));

        assertEquals(Lists.immutable.of(node(BinaryOperation.subtract(TWO, THREE))),
                ResolutionPasses.applyAdditive(parts, false));
        assertEquals(Lists.immutable.of(node(BinaryOperation.add(TWO, UnaryOperation.negate(THREE)))),
                ResolutionPasses.applyAdditive(parts, true));
    }

    @Test
    @DisplayName("Operator next to another operator")
    void testOperatorAsOperand() {
        ImmutableList<Part> parts = Lists.immutable.of(node(TWO), text("*"), text("+"), node(THREE));

        assertThrows(MissingOperatorOperandException.class, () -> ResolutionPasses.applyMultiplicative(parts));
    }

    @Test
    @DisplayName("Finishing requires exactly one node")
    void testFinish() {
        assertEquals(TWO, ResolutionPasses.finish(Lists.immutable.of(node(TWO))));

        CantProcessExpressionException e = assertThrows(CantProcessExpressionException.class,
                () -> ResolutionPasses.finish(Lists.immutable.of(node(TWO), text("?"))));
        assertEquals(2, e.getParts().size());
        assertEquals("?", e.getParts().get(1));
    }
}
