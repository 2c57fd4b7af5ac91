package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.mathparser.parse.Token.TokenType;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Math Lexer Tests")
class MathLexerTest {

    private static ImmutableList<Token> tokenize(String span, String... vocabulary) {
        return new MathLexer(span, 0, Lists.immutable.of(vocabulary)).tokenize();
    }

    @Test
    @DisplayName("Longest word is matched first")
    void testLongestMatch() {
        ImmutableList<Token> tokens = tokenize("2xy+3.5", "xy", "x");

        assertEquals(Lists.immutable.of(
                new Token(TokenType.NUMBER, "2", 0),
                new Token(TokenType.WORD, "xy", 1),
                new Token(TokenType.OPERATOR, "+", 3),
                new Token(TokenType.NUMBER, "3.5", 4)), tokens);
    }

    @Test
    @DisplayName("Whitespace is dropped but positions are kept")
    void testWhitespace() {
        ImmutableList<Token> tokens = tokenize("sin  x", "sin", "x");

        assertEquals(Lists.immutable.of(
                new Token(TokenType.WORD, "sin", 0),
                new Token(TokenType.WORD, "x", 5)), tokens);
    }

    @Test
    @DisplayName("Span offset shifts positions")
    void testOffset() {
        ImmutableList<Token> tokens = new MathLexer("1", 7, Lists.immutable.empty()).tokenize();

        assertEquals(7, tokens.getOnly().position());
    }

    @Test
    @DisplayName("Unmatched characters are grouped")
    void testUnknown() {
        ImmutableList<Token> tokens = tokenize("2$#3");

        assertEquals(Lists.immutable.of(
                new Token(TokenType.NUMBER, "2", 0),
                new Token(TokenType.UNKNOWN, "$#", 1),
                new Token(TokenType.NUMBER, "3", 3)), tokens);
    }

    @Test
    @DisplayName("A trailing period is not part of a number")
    void testTrailingPeriod() {
        ImmutableList<Token> tokens = tokenize("2.");

        assertEquals(Lists.immutable.of(
                new Token(TokenType.NUMBER, "2", 0),
                new Token(TokenType.UNKNOWN, ".", 1)), tokens);
    }

    @Test
    @DisplayName("Undeclared words are unknown")
    void testUndeclaredWord() {
        ImmutableList<Token> tokens = tokenize("y*x", "x");

        assertEquals(TokenType.UNKNOWN, tokens.get(0).type());
        assertEquals(TokenType.OPERATOR, tokens.get(1).type());
        assertEquals(TokenType.WORD, tokens.get(2).type());
    }
}
