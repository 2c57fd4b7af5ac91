package org.mathparser.error;

/**
 * A function received no argument list, or a list whose size is outside the
 * arity the function accepts.
 */
public class OutOfRangeFunctionArgumentListException extends MathParseException {

    private final String function;
    private final int argumentCount;

    public OutOfRangeFunctionArgumentListException(String function, int argumentCount) {
        super("\"" + function + "\" can't be called with " + argumentCount + " argument(s)");
        this.function = function;
        this.argumentCount = argumentCount;
    }

    public String getFunction() {
        return function;
    }

    public int getArgumentCount() {
        return argumentCount;
    }
}
