package org.mathparser.parse;

import org.mathparser.error.MathException;
import org.mathparser.error.ParsingFailedException;
import org.mathparser.node.MathExpression;
import org.mathparser.node.MathNode;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parser for textual math expressions.
 *
 * Parses expressions like:
 * (2x)^(e^3 + 4) + cos(3)x
 * log(2, x + 1) / sqrt(y)
 *
 * Parse priority:
 * 1. Brackets () [] (commas inside separate function arguments)
 * 2. Variables and the constants e, pi (π)
 * 3. Functions: custom ones, sin, cos, tan (tg), cot (ctg), sqrt (√),
 *    ln, lg, log, asin (arcsin), acos (arccos), atan (arctg), acot (arcctg)
 * 4. Unary minus
 * 5. Power (^)
 * 6. Implicit multiplication (2x, (x+1)(x-1))
 * 7. Division (/) and multiplication (*)
 * 8. Subtraction (-) and addition (+)
 *
 * Names are case-sensitive.
 */
public final class MathParser {

    private static final Logger LOGGER = Logger.getLogger(MathParser.class.getName());

    private MathParser() {
    }

    /**
     * Parses with {@link ParserOptions#defaults()}.
     */
    public static MathNode parse(String expression) {
        return parse(expression, ParserOptions.defaults());
    }

    /**
     * Parses an arithmetic expression.
     *
     * @param expression The expression to convert
     * @param options    Declared names and parsing switches
     * @return The root of the parsed tree
     * @throws org.mathparser.error.MathParseException if the expression or the declarations are invalid
     */
    public static MathNode parse(String expression, ParserOptions options) {
        return run(expression, options, resolver -> resolver.resolve(expression, 0));
    }

    public static MathExpression parseExtended(String expression) {
        return parseExtended(expression, ParserOptions.defaults());
    }

    /**
     * Like {@link #parse(String, ParserOptions)}, but also accepts the
     * comparison operators =, &lt;, &gt;, &lt;= and &gt;=, returning a
     * {@link org.mathparser.node.MathComparison} when any is present.
     */
    public static MathExpression parseExtended(String expression, ParserOptions options) {
        return run(expression, options, resolver -> ComparisonParser.parse(expression, resolver));
    }

    private static <T extends MathExpression> T run(String expression, ParserOptions options,
            Function<ExpressionResolver, T> parser) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        LOGGER.fine(() -> "Parsing expression: " + expression);

        try {
            NameValidator.checkDeclarations(options.variableNames(), options.customFunctions());
            T result = parser.apply(new ExpressionResolver(options));
            LOGGER.fine(() -> "Parsed '" + expression + "' into " + result);
            return result;
        } catch (MathException e) {
            LOGGER.log(Level.FINE, "Failed to parse '" + expression + "'", e);
            throw e;
        } catch (RuntimeException e) {
            throw new ParsingFailedException(String.valueOf(e.getMessage()), e);
        }
    }

    /**
     * Guesses the variable and function names an expression uses, assuming
     * implicit multiplication is off.
     *
     * @param hideBuiltIns Leave e, pi and π out of the variables
     */
    public static DefinableNames detectDefinable(String expression, boolean hideBuiltIns) {
        return DefinableNameDetector.detect(expression, hideBuiltIns);
    }

    /**
     * Guesses the function names an expression uses, assuming implicit
     * multiplication is off.
     *
     * @param hideBuiltIns Leave out bracket functions such as sin and log
     */
    public static Set<String> detectFunctionNames(String expression, boolean hideBuiltIns) {
        return DefinableNameDetector.detectFunctions(expression, hideBuiltIns);
    }

    public static boolean isNameValid(String name) {
        return isNameValid(name, false);
    }

    /**
     * Whether {@code name} can be declared as a variable, or as a function when
     * {@code isFunction} is set.
     */
    public static boolean isNameValid(String name, boolean isFunction) {
        return NameValidator.isValid(name, isFunction);
    }

    /**
     * The predefined constants: e, pi and π.
     */
    public static Set<String> builtInVariables() {
        return BuiltIns.VARIABLES.castToSet();
    }

    public static Set<String> builtInFunctions() {
        return BuiltIns.FUNCTIONS.castToSet();
    }
}
