package org.mathparser.error;

/**
 * A declared variable name doesn't follow the naming rules.
 */
public class InvalidVariableNameException extends MathParseException {

    private final String name;

    public InvalidVariableNameException(String name) {
        super("\"" + name + "\" is not a valid variable name");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
