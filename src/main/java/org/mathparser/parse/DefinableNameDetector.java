package org.mathparser.parse;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses which names in a raw expression are meant as variables or functions.
 *
 * The guess assumes implicit multiplication is off: with it on, {@code xy}
 * may be one name or two, and {@code f(x)} a call or a product.
 */
final class DefinableNameDetector {

    private static final String NAME = "[" + NameValidator.LETTERS + "_]" + NameValidator.NAME_TAIL;

    private static final Pattern NAME_PATTERN = Pattern.compile(NAME);
    private static final Pattern FUNCTION_PATTERN = Pattern.compile("(" + NAME + ")\\(");

    private DefinableNameDetector() {
    }

    /**
     * Names directly followed by {@code (}. With {@code hideBuiltIns},
     * bracket functions such as {@code sin} are left out.
     */
    static Set<String> detectFunctions(String expression, boolean hideBuiltIns) {
        Set<String> functions = new LinkedHashSet<>();
        Matcher matcher = FUNCTION_PATTERN.matcher(expression);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!hideBuiltIns || !BuiltIns.isFunction(name)) {
                functions.add(name);
            }
        }
        return Collections.unmodifiableSet(functions);
    }

    /**
     * All names that are neither bracket functions nor detected functions.
     * With {@code hideBuiltIns}, the constants e, pi and π are left out of the variables.
     */
    static DefinableNames detect(String expression, boolean hideBuiltIns) {
        Set<String> functions = detectFunctions(expression, false);
        Set<String> variables = new LinkedHashSet<>();

        Matcher matcher = NAME_PATTERN.matcher(expression);
        while (matcher.find()) {
            String name = matcher.group();
            if (!BuiltIns.isFunction(name)
                    && !(hideBuiltIns && BuiltIns.VARIABLES.contains(name))
                    && !functions.contains(name)) {
                variables.add(name);
            }
        }

        return new DefinableNames(variables, functions);
    }
}
