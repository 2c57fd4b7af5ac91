package org.mathparser.error;

/**
 * The same name was declared both as a variable and as a custom function.
 */
public class DuplicateDeclarationException extends MathParseException {

    private final String name;

    public DuplicateDeclarationException(String name) {
        super("\"" + name + "\" is declared both as a variable and as a function");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
