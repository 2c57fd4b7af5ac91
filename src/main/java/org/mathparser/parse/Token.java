package org.mathparser.parse;

/**
 * Represents a token produced by {@link MathLexer}.
 *
 * @param type     The token type
 * @param value    The token text
 * @param position The position in the parsed expression
 */
record Token(TokenType type, String value, int position) {

    enum TokenType {
        NUMBER, // 42, 3.14
        WORD, // declared variable or function, built-in constant or function
        OPERATOR, // + - ^ / *
        UNKNOWN, // anything else, reported if never consumed
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + position;
    }
}
