package org.mathparser.error;

/**
 * A closing bracket doesn't match the most recently opened one, or nothing is open.
 */
public class UnexpectedClosingBracketException extends MathParseException {

    private final char bracket;

    public UnexpectedClosingBracketException(char bracket, int position) {
        super("Unexpected closing bracket '" + bracket + "'", position);
        this.bracket = bracket;
    }

    public char getBracket() {
        return bracket;
    }
}
