package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.mathparser.parse.Token.TokenType;

/**
 * Lexer for a bracket-free span of an expression.
 *
 * Whitespace is dropped first, then the span is split into numbers, words of
 * the active vocabulary and single-character operators. The vocabulary is
 * sorted longest-first so that a name never matches as the prefix of a
 * longer one. Characters matching nothing are kept together as UNKNOWN tokens.
 */
final class MathLexer {

    private static final String OPERATORS = "+-^/*";

    private final String input;
    private final int[] offsets;
    private final ImmutableList<String> vocabulary;
    private final MutableList<Token> tokens = Lists.mutable.empty();
    private int position;
    private int unknownStart = -1;

    /**
     * @param span       The text to tokenize
     * @param offset     Position of the span in the whole expression
     * @param vocabulary Known words, longest first
     */
    MathLexer(String span, int offset, ImmutableList<String> vocabulary) {
        StringBuilder compact = new StringBuilder(span.length());
        int[] positions = new int[span.length()];
        for (int i = 0; i < span.length(); i++) {
            char c = span.charAt(i);
            if (!Character.isWhitespace(c)) {
                positions[compact.length()] = offset + i;
                compact.append(c);
            }
        }
        this.input = compact.toString();
        this.offsets = positions;
        this.vocabulary = vocabulary;
    }

    /**
     * Tokenizes the entire span.
     */
    ImmutableList<Token> tokenize() {
        while (position < input.length()) {
            char c = input.charAt(position);

            String word = matchWord();
            if (word != null) {
                emit(TokenType.WORD, word);
            } else if (isDigit(c)) {
                emit(TokenType.NUMBER, readNumber());
            } else if (OPERATORS.indexOf(c) >= 0) {
                emit(TokenType.OPERATOR, String.valueOf(c));
            } else {
                if (unknownStart < 0) {
                    unknownStart = position;
                }
                position++;
            }
        }

        flushUnknown();
        return tokens.toImmutable();
    }

    private String matchWord() {
        for (String word : vocabulary) {
            if (input.startsWith(word, position)) {
                return word;
            }
        }
        return null;
    }

    private String readNumber() {
        int end = position;
        while (end < input.length() && isDigit(input.charAt(end))) {
            end++;
        }
        if (end + 1 < input.length() && input.charAt(end) == '.' && isDigit(input.charAt(end + 1))) {
            end++;
            while (end < input.length() && isDigit(input.charAt(end))) {
                end++;
            }
        }
        return input.substring(position, end);
    }

    private void emit(TokenType type, String value) {
        flushUnknown();
        tokens.add(new Token(type, value, offsets[position]));
        position += value.length();
    }

    private void flushUnknown() {
        if (unknownStart >= 0) {
            tokens.add(new Token(TokenType.UNKNOWN, input.substring(unknownStart, position), offsets[unknownStart]));
            unknownStart = -1;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
