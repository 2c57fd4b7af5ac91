package org.mathparser.parse;

import org.mathparser.node.CustomFunctions;
import org.mathparser.node.FunctionDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable settings for {@link MathParser}.
 *
 * @param minusNegativeFunction  Parse {@code a - b} as {@code a + (-b)}
 * @param implicitMultiplication Multiply neighbouring expressions without an explicit {@code *}
 * @param variableNames          Names parsed as variables
 * @param customFunctions        Names parsed as custom functions, with their argument ranges
 * @param maxNestingDepth        Deepest bracket nesting accepted
 * @param maxTreeDepth           Deepest node tree accepted, counting one level per operation
 */
public record ParserOptions(
        boolean minusNegativeFunction,
        boolean implicitMultiplication,
        Set<String> variableNames,
        CustomFunctions customFunctions,
        int maxNestingDepth,
        int maxTreeDepth) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_MAX_TREE_DEPTH = 512;

    public static final String MINUS_NEGATIVE_FUNCTION_KEY = "mathparser.minusNegativeFunction";
    public static final String IMPLICIT_MULTIPLICATION_KEY = "mathparser.implicitMultiplication";
    public static final String VARIABLES_KEY = "mathparser.variables";
    public static final String MAX_NESTING_DEPTH_KEY = "mathparser.maxNestingDepth";
    public static final String MAX_TREE_DEPTH_KEY = "mathparser.maxTreeDepth";

    private static final ParserOptions DEFAULTS = new ParserOptions(
            false, true, Set.of("x"), CustomFunctions.none(), DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_TREE_DEPTH);

    public ParserOptions {
        variableNames = Set.copyOf(Objects.requireNonNull(variableNames, "Variable names cannot be null"));
        customFunctions = customFunctions != null ? customFunctions : CustomFunctions.none();
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Max nesting depth must be positive, got: " + maxNestingDepth);
        }
        if (maxTreeDepth < 1) {
            throw new IllegalArgumentException("Max tree depth must be positive, got: " + maxTreeDepth);
        }
    }

    /**
     * No negation rewrite, implicit multiplication on, variable {@code x}, no custom functions.
     */
    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public ParserOptions withMinusNegativeFunction(boolean enabled) {
        return new ParserOptions(enabled, implicitMultiplication, variableNames, customFunctions, maxNestingDepth,
                maxTreeDepth);
    }

    public ParserOptions withImplicitMultiplication(boolean enabled) {
        return new ParserOptions(minusNegativeFunction, enabled, variableNames, customFunctions, maxNestingDepth,
                maxTreeDepth);
    }

    public ParserOptions withVariableNames(Set<String> names) {
        return new ParserOptions(minusNegativeFunction, implicitMultiplication, names, customFunctions, maxNestingDepth,
                maxTreeDepth);
    }

    public ParserOptions withVariableNames(String... names) {
        return withVariableNames(new LinkedHashSet<>(Arrays.asList(names)));
    }

    public ParserOptions withCustomFunctions(CustomFunctions functions) {
        return new ParserOptions(minusNegativeFunction, implicitMultiplication, variableNames, functions, maxNestingDepth,
                maxTreeDepth);
    }

    public ParserOptions withCustomFunctions(FunctionDefinition... definitions) {
        return withCustomFunctions(CustomFunctions.of(definitions));
    }

    public ParserOptions withMaxNestingDepth(int depth) {
        return new ParserOptions(minusNegativeFunction, implicitMultiplication, variableNames, customFunctions, depth,
                maxTreeDepth);
    }

    public ParserOptions withMaxTreeDepth(int depth) {
        return new ParserOptions(minusNegativeFunction, implicitMultiplication, variableNames, customFunctions,
                maxNestingDepth, depth);
    }

    /**
     * Reads options from properties; missing keys keep their default.
     * Custom functions can't be expressed as properties and stay empty.
     *
     * @throws IllegalArgumentException if a depth isn't a positive number
     */
    public static ParserOptions fromProperties(Properties properties) {
        ParserOptions options = DEFAULTS;

        String minusNegative = properties.getProperty(MINUS_NEGATIVE_FUNCTION_KEY);
        if (minusNegative != null) {
            options = options.withMinusNegativeFunction(Boolean.parseBoolean(minusNegative.trim()));
        }

        String implicit = properties.getProperty(IMPLICIT_MULTIPLICATION_KEY);
        if (implicit != null) {
            options = options.withImplicitMultiplication(Boolean.parseBoolean(implicit.trim()));
        }

        String variables = properties.getProperty(VARIABLES_KEY);
        if (variables != null) {
            options = options.withVariableNames(Arrays.stream(variables.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }

        String nestingDepth = properties.getProperty(MAX_NESTING_DEPTH_KEY);
        if (nestingDepth != null) {
            options = options.withMaxNestingDepth(parseDepth(MAX_NESTING_DEPTH_KEY, nestingDepth));
        }

        String treeDepth = properties.getProperty(MAX_TREE_DEPTH_KEY);
        if (treeDepth != null) {
            options = options.withMaxTreeDepth(parseDepth(MAX_TREE_DEPTH_KEY, treeDepth));
        }

        return options;
    }

    private static int parseDepth(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    /**
     * Reads options from a properties file on the classpath.
     *
     * @param resource Absolute classpath location, e.g. {@code /mathparser.properties}
     */
    public static ParserOptions fromResource(String resource) {
        try (InputStream in = ParserOptions.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }
}
