package org.mathparser.parse;

import java.util.Set;

/**
 * Candidate names found by {@link MathParser#detectDefinable}.
 *
 * @param variables Names that look like variables
 * @param functions Names that are directly followed by an opening bracket
 */
public record DefinableNames(Set<String> variables, Set<String> functions) {

    public DefinableNames {
        variables = Set.copyOf(variables);
        functions = Set.copyOf(functions);
    }
}
