package org.mathparser.error;

/**
 * Brackets or operations are nested deeper than the parser is configured to follow.
 */
public class ExpressionTooDeepException extends MathParseException {

    private final int limit;

    public ExpressionTooDeepException(int limit, int position) {
        this("Brackets are nested", limit, position);
    }

    /**
     * @param nested What is nested too deeply, e.g. "Operations are nested"
     */
    public ExpressionTooDeepException(String nested, int limit, int position) {
        super(nested + " deeper than " + limit + " levels", position);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
