package org.mathparser.error;

/**
 * A custom function declares an argument range with a negative minimum or a
 * maximum below its minimum.
 */
public class InvalidFunctionArgumentsDeclarationException extends MathParseException {

    private final String function;

    public InvalidFunctionArgumentsDeclarationException(String function) {
        super("\"" + function + "\" declares an invalid argument count range");
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
