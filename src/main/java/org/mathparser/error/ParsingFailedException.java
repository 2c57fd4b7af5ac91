package org.mathparser.error;

/**
 * Wraps an unexpected failure that happened while parsing.
 */
public class ParsingFailedException extends MathParseException {

    public ParsingFailedException(String description, Throwable cause) {
        super("Parsing failed: " + description, cause);
    }
}
