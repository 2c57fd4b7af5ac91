package org.mathparser.parse;

import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.mathparser.error.OutOfRangeFunctionArgumentListException;
import org.mathparser.error.UnknownOperationException;
import org.mathparser.node.BinaryOperation;
import org.mathparser.node.Constant;
import org.mathparser.node.MathNode;
import org.mathparser.node.UnaryOperation;

/**
 * Built-in constants and bracket functions, with the synonyms the parser accepts.
 *
 * Built-in names can be shadowed: a declared variable named {@code e} or
 * {@code pi} wins over the constant, and a custom function may reuse a
 * bracket-function name.
 */
final class BuiltIns {

    static final ImmutableSet<String> VARIABLES = Sets.immutable.of("e", "pi", "π");

    static final ImmutableSet<String> FUNCTIONS = Sets.immutable.of(
            "sin", "cos",
            "tan", "tg",
            "cot", "ctg",
            "sqrt", "√",
            "ln", "lg", "log",
            "asin", "arcsin",
            "acos", "arccos",
            "atan", "arctg",
            "acot", "arcctg");

    private BuiltIns() {
    }

    static boolean isFunction(String name) {
        return FUNCTIONS.contains(name);
    }

    static boolean isPi(String name) {
        return "pi".equals(name) || "π".equals(name);
    }

    /**
     * Builds the node for a bracket function applied to its arguments.
     * {@code log} takes either the argument alone (base 10) or the base followed by the argument.
     */
    static MathNode apply(String name, ImmutableList<MathNode> arguments) {
        if ("log".equals(name)) {
            return switch (arguments.size()) {
                case 1 -> BinaryOperation.log(new Constant(10), arguments.get(0));
                case 2 -> BinaryOperation.log(arguments.get(0), arguments.get(1));
                default -> throw new OutOfRangeFunctionArgumentListException(name, arguments.size());
            };
        }
        if (arguments.size() != 1) {
            throw new OutOfRangeFunctionArgumentListException(name, arguments.size());
        }

        MathNode x = arguments.getFirst();
        return switch (name) {
            case "sin" -> new UnaryOperation(UnaryOperation.Operator.SIN, x);
            case "cos" -> new UnaryOperation(UnaryOperation.Operator.COS, x);
            case "tan", "tg" -> new UnaryOperation(UnaryOperation.Operator.TAN, x);
            case "cot", "ctg" -> new UnaryOperation(UnaryOperation.Operator.COT, x);
            case "asin", "arcsin" -> new UnaryOperation(UnaryOperation.Operator.ASIN, x);
            case "acos", "arccos" -> new UnaryOperation(UnaryOperation.Operator.ACOS, x);
            case "atan", "arctg" -> new UnaryOperation(UnaryOperation.Operator.ATAN, x);
            case "acot", "arcctg" -> new UnaryOperation(UnaryOperation.Operator.ACOT, x);
            case "sqrt", "√" -> BinaryOperation.power(x, new Constant(0.5));
            case "ln" -> BinaryOperation.log(UnaryOperation.e(), x);
            case "lg" -> BinaryOperation.log(new Constant(2), x);
            default -> throw new UnknownOperationException(name);
        };
    }
}
