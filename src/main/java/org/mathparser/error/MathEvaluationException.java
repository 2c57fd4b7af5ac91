package org.mathparser.error;

/**
 * Exception thrown while computing the value of an already parsed expression.
 */
public abstract class MathEvaluationException extends MathException {

    protected MathEvaluationException(String message) {
        super(message);
    }
}
