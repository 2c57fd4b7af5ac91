package org.mathparser.error;

/**
 * Exception thrown when an expression string cannot be turned into a tree.
 * Includes an optional character position into the parsed string.
 */
public abstract class MathParseException extends MathException {

    private final int position;

    protected MathParseException(String message) {
        super(message);
        this.position = -1;
    }

    protected MathParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    protected MathParseException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasLocation() {
        return position >= 0;
    }
}
