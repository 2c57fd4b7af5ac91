package org.mathparser.error;

import java.util.List;

/**
 * Parsing finished with something other than a single resolved expression.
 */
public class CantProcessExpressionException extends MathParseException {

    private final List<String> parts;

    public CantProcessExpressionException(List<String> parts) {
        super("Some parts of the expression were left unprocessed: " + parts
                + ". This often happens when the multiplication operator is omitted"
                + " while implicit multiplication is disabled, or when a name wasn't declared");
        this.parts = List.copyOf(parts);
    }

    public List<String> getParts() {
        return parts;
    }
}
