package org.mathparser.parse;

import org.junit.jupiter.api.*;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Definable Name Detector Tests")
class DefinableNameDetectorTest {

    @Test
    @DisplayName("Variables and functions are told apart by the bracket")
    void testDetect() {
        DefinableNames names = MathParser.detectDefinable("a*b+sin(c)+f(x)", false);

        assertEquals(Set.of("a", "b", "c", "x"), names.variables());
        assertEquals(Set.of("sin", "f"), names.functions());
    }

    @Test
    @DisplayName("Constants are hidden on request")
    void testHideBuiltInConstants() {
        assertEquals(Set.of("x", "y"), MathParser.detectDefinable("e^x+pi*y", true).variables());
        assertEquals(Set.of("e", "x", "pi", "y"), MathParser.detectDefinable("e^x+pi*y", false).variables());
    }

    @Test
    @DisplayName("Bracket functions are hidden on request")
    void testDetectFunctionNames() {
        assertEquals(Set.of("g"), MathParser.detectFunctionNames("sin(x)+g(x)", true));
        assertEquals(Set.of("sin", "g"), MathParser.detectFunctionNames("sin(x)+g(x)", false));
    }

    @Test
    @DisplayName("Apostrophes and underscores belong to the name")
    void testNameCharacters() {
        DefinableNames names = MathParser.detectDefinable("y'+y+_h(x_1)", false);

        assertEquals(Set.of("y'", "y", "x_1"), names.variables());
        assertEquals(Set.of("_h"), names.functions());
    }

    @Test
    @DisplayName("Expression without names")
    void testNoNames() {
        DefinableNames names = MathParser.detectDefinable("2+3*(4-1)", true);

        assertTrue(names.variables().isEmpty());
        assertTrue(names.functions().isEmpty());
    }
}
