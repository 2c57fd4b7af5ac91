package org.mathparser.error;

/**
 * An opened bracket is still open when the expression ends.
 */
public class BracketsNotClosedException extends MathParseException {

    private final char bracket;
    private final int endPosition;

    public BracketsNotClosedException(char bracket, int startPosition, int endPosition) {
        super("Bracket '" + bracket + "' is not closed before position " + endPosition, startPosition);
        this.bracket = bracket;
        this.endPosition = endPosition;
    }

    public char getBracket() {
        return bracket;
    }

    public int getStartPosition() {
        return getPosition();
    }

    public int getEndPosition() {
        return endPosition;
    }
}
