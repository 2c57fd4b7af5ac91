package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.mathparser.error.CantProcessExpressionException;
import org.mathparser.error.MissingOperatorOperandException;
import org.mathparser.error.OutOfRangeFunctionArgumentListException;
import org.mathparser.error.UnknownOperationException;
import org.mathparser.node.BinaryOperation;
import org.mathparser.node.Constant;
import org.mathparser.node.CustomFunctions;
import org.mathparser.node.FreeformCall;
import org.mathparser.node.FunctionDefinition;
import org.mathparser.node.MathNode;
import org.mathparser.node.UnaryOperation;
import org.mathparser.node.Variable;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The priority-ordered passes that fold a part sequence into one node.
 *
 * Passes run in this order, each on the output of the previous one:
 * 1. variables and constants (e, pi, π)
 * 2. custom and built-in functions
 * 3. unary minus
 * 4. power (^)
 * 5. implicit multiplication (when enabled)
 * 6. division and multiplication (/ *)
 * 7. subtraction and addition (- +)
 *
 * Every pass scans left to right and returns a new sequence.
 */
final class ResolutionPasses {

    private static final ImmutableSet<String> POWER = Sets.immutable.of("^");
    private static final ImmutableSet<String> MULTIPLICATIVE = Sets.immutable.of("/", "*");
    private static final ImmutableSet<String> ADDITIVE = Sets.immutable.of("-", "+");

    @FunctionalInterface
    private interface OperatorFolder {
        MathNode fold(String operator, MathNode left, MathNode right);
    }

    private ResolutionPasses() {
    }

    static ImmutableList<Part> substituteVariables(ImmutableList<Part> parts, Set<String> variableNames) {
        return parts.collect(part -> substituteVariable(part, variableNames));
    }

    private static Part substituteVariable(Part part, Set<String> variableNames) {
        if (part instanceof Part.Text text) {
            if (variableNames.contains(text.text())) {
                return new Part.Resolved(new Variable(text.text()));
            }
            if (text.is("e")) {
                return new Part.Resolved(UnaryOperation.e());
            }
            if (BuiltIns.isPi(text.text())) {
                return new Part.Resolved(Constant.PI);
            }
        }
        return part;
    }

    /**
     * Applies each function name to the node or argument list right after it.
     * Custom functions win over built-ins of the same name.
     */
    static ImmutableList<Part> applyFunctions(ImmutableList<Part> parts, CustomFunctions functions) {
        MutableList<Part> result = Lists.mutable.empty();

        for (int i = 0; i < parts.size(); i++) {
            Part part = parts.get(i);
            if (!(part instanceof Part.Text text)) {
                result.add(part);
                continue;
            }

            ImmutableList<MathNode> arguments = argumentsAt(parts, i + 1);
            Optional<FunctionDefinition> custom = functions.byName(text.text());

            if (custom.isPresent()) {
                List<MathNode> callArguments = arguments == null ? List.of() : arguments.castToList();
                result.add(new Part.Resolved(new FreeformCall(custom.get(), callArguments)));
                if (arguments != null) {
                    i++;
                }
            } else if (BuiltIns.isFunction(text.text())) {
                if (arguments == null) {
                    throw new OutOfRangeFunctionArgumentListException(text.text(), 0);
                }
                result.add(new Part.Resolved(BuiltIns.apply(text.text(), arguments)));
                i++;
            } else {
                result.add(part);
            }
        }

        return result.toImmutable();
    }

    private static ImmutableList<MathNode> argumentsAt(ImmutableList<Part> parts, int index) {
        if (index >= parts.size()) {
            return null;
        }
        Part part = parts.get(index);
        if (part instanceof Part.Resolved resolved) {
            return Lists.immutable.of(resolved.node());
        }
        if (part instanceof Part.Arguments arguments) {
            return arguments.nodes();
        }
        return null;
    }

    /**
     * Negates the node after a minus that starts the sequence or follows
     * something other than a resolved node.
     */
    static ImmutableList<Part> applyUnaryMinus(ImmutableList<Part> parts) {
        MutableList<Part> result = Lists.mutable.empty();

        for (int i = 0; i < parts.size(); i++) {
            Part part = parts.get(i);
            boolean unary = part instanceof Part.Text text
                    && text.is("-")
                    && i + 1 < parts.size()
                    && (result.isEmpty() || !(result.getLast() instanceof Part.Resolved));

            if (unary) {
                result.add(new Part.Resolved(UnaryOperation.negate(operand(parts.get(i + 1), "-"))));
                i++;
            } else {
                result.add(part);
            }
        }

        return result.toImmutable();
    }

    /**
     * Folds {@code ^} left to right. The constant e as a base becomes the
     * natural exponent of the right operand.
     */
    static ImmutableList<Part> applyPower(ImmutableList<Part> parts) {
        return foldOperators(parts, POWER, (operator, left, right) ->
                left instanceof UnaryOperation base && base.isEulerConstant()
                        ? UnaryOperation.naturalExp(right)
                        : BinaryOperation.power(left, right));
    }

    /**
     * Multiplies every run of adjacent resolved nodes, left to right.
     */
    static ImmutableList<Part> applyImplicitMultiplication(ImmutableList<Part> parts) {
        MutableList<Part> result = Lists.mutable.empty();

        for (Part part : parts) {
            if (part instanceof Part.Resolved right
                    && result.notEmpty()
                    && result.getLast() instanceof Part.Resolved left) {
                result.set(result.size() - 1, new Part.Resolved(BinaryOperation.multiply(left.node(), right.node())));
            } else {
                result.add(part);
            }
        }

        return result.toImmutable();
    }

    static ImmutableList<Part> applyMultiplicative(ImmutableList<Part> parts) {
        return foldOperators(parts, MULTIPLICATIVE, (operator, left, right) ->
                "/".equals(operator)
                        ? BinaryOperation.divide(left, right)
                        : BinaryOperation.multiply(left, right));
    }

    /**
     * Folds {@code -} and {@code +}. With {@code minusNegativeFunction},
     * {@code a - b} becomes {@code a + (-b)}.
     */
    static ImmutableList<Part> applyAdditive(ImmutableList<Part> parts, boolean minusNegativeFunction) {
        return foldOperators(parts, ADDITIVE, (operator, left, right) -> {
            if ("+".equals(operator)) {
                return BinaryOperation.add(left, right);
            }
            return minusNegativeFunction
                    ? BinaryOperation.add(left, UnaryOperation.negate(right))
                    : BinaryOperation.subtract(left, right);
        });
    }

    /**
     * Returns the only node left after all passes.
     *
     * @throws CantProcessExpressionException if anything else is left
     */
    static MathNode finish(ImmutableList<Part> parts) {
        if (parts.size() == 1 && parts.getFirst() instanceof Part.Resolved resolved) {
            return resolved.node();
        }
        throw new CantProcessExpressionException(parts.collect(Part::describe).castToList());
    }

    private static ImmutableList<Part> foldOperators(ImmutableList<Part> parts, ImmutableSet<String> operators,
            OperatorFolder folder) {
        MutableList<Part> result = Lists.mutable.empty();

        for (int i = 0; i < parts.size(); i++) {
            Part part = parts.get(i);
            if (!(part instanceof Part.Text text) || !operators.contains(text.text())) {
                result.add(part);
                continue;
            }

            if (result.isEmpty() || i + 1 == parts.size()) {
                throw new MissingOperatorOperandException(text.text());
            }

            MathNode left = operand(result.remove(result.size() - 1), text.text());
            MathNode right = operand(parts.get(i + 1), text.text());
            result.add(new Part.Resolved(folder.fold(text.text(), left, right)));
            i++;
        }

        return result.toImmutable();
    }

    /**
     * Coerces the neighbor of {@code operator} into a node.
     */
    private static MathNode operand(Part part, String operator) {
        if (part instanceof Part.Resolved resolved) {
            return resolved.node();
        }
        if (part instanceof Part.Text text) {
            if (text.isOperator()) {
                throw new MissingOperatorOperandException(operator);
            }
            throw new CantProcessExpressionException(List.of(text.text()));
        }
        throw new UnknownOperationException(part.describe());
    }
}
