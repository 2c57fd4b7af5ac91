package org.mathparser.error;

/**
 * A declared function name doesn't follow the naming rules.
 */
public class InvalidFunctionNameException extends MathParseException {

    private final String name;

    public InvalidFunctionNameException(String name) {
        super("\"" + name + "\" is not a valid function name");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
