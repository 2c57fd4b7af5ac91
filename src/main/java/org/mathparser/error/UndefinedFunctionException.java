package org.mathparser.error;

/**
 * A custom function used by the expression has no compatible implementation.
 */
public class UndefinedFunctionException extends MathEvaluationException {

    private final String function;

    public UndefinedFunctionException(String function) {
        super("Function " + function + " has no compatible implementation");
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
