package org.mathparser.error;

/**
 * Root of every failure raised while parsing or evaluating a math expression.
 */
public abstract class MathException extends RuntimeException {

    protected MathException(String message) {
        super(message);
    }

    protected MathException(String message, Throwable cause) {
        super(message, cause);
    }
}
