package org.mathparser.error;

/**
 * A part of the expression can't be used in the context it appears in.
 */
public class UnknownOperationException extends MathParseException {

    private final String operation;

    public UnknownOperationException(String operation) {
        super("\"" + operation + "\" is an unknown operation in given context");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
