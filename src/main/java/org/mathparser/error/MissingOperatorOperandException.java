package org.mathparser.error;

/**
 * An operator has no usable expression on one of its sides.
 */
public class MissingOperatorOperandException extends MathParseException {

    private final String operator;

    public MissingOperatorOperandException(String operator) {
        super("\"" + operator + "\" has insufficient neighboring expressions");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
