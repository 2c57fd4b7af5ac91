package org.mathparser.parse;

import org.mathparser.error.DuplicateDeclarationException;
import org.mathparser.error.InvalidFunctionArgumentsDeclarationException;
import org.mathparser.error.InvalidFunctionNameException;
import org.mathparser.error.InvalidVariableNameException;
import org.mathparser.node.CustomFunctions;
import org.mathparser.node.FunctionDefinition;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Naming rules for declared variables and custom functions.
 *
 * A name starts with a Latin or Greek letter (functions may also start with
 * an underscore), continues with letters, digits, underscores or periods,
 * never ends with a period, and may carry trailing apostrophes ({@code y'}).
 * Variables can't reuse a bracket-function name; functions can.
 */
final class NameValidator {

    static final String LETTERS = "a-zA-Zα-ωΑ-Ω";

    /** Everything after the first character of a name. */
    static final String NAME_TAIL = "(?:[" + LETTERS + "0-9_.]*[" + LETTERS + "0-9_])?'*";

    private static final Pattern VARIABLE_NAME = Pattern.compile("[" + LETTERS + "]" + NAME_TAIL);
    private static final Pattern FUNCTION_NAME = Pattern.compile("[" + LETTERS + "_]" + NAME_TAIL);

    private NameValidator() {
    }

    static boolean isValid(String name, boolean isFunction) {
        if (name == null) {
            return false;
        }
        if (isFunction) {
            return FUNCTION_NAME.matcher(name).matches();
        }
        return VARIABLE_NAME.matcher(name).matches() && !BuiltIns.isFunction(name);
    }

    /**
     * Checks every declaration before parsing starts.
     */
    static void checkDeclarations(Set<String> variableNames, CustomFunctions functions) {
        for (String name : variableNames) {
            if (!isValid(name, false)) {
                throw new InvalidVariableNameException(name);
            }
        }

        for (FunctionDefinition definition : functions.definitions()) {
            if (!isValid(definition.name(), true)) {
                throw new InvalidFunctionNameException(definition.name());
            }
            if (definition.minArgs() < 0 || definition.maxArgs() < definition.minArgs()) {
                throw new InvalidFunctionArgumentsDeclarationException(definition.toString());
            }
            if (variableNames.contains(definition.name())) {
                throw new DuplicateDeclarationException(definition.name());
            }
        }
    }
}
