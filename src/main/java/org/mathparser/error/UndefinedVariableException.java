package org.mathparser.error;

/**
 * A variable used by the expression has no value. Variable names are case-sensitive.
 */
public class UndefinedVariableException extends MathEvaluationException {

    private final String name;

    public UndefinedVariableException(String name) {
        super("Variable \"" + name + "\" has no value. Variable names are case-sensitive");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
