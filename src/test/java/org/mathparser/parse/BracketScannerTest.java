package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.mathparser.error.BracketsNotClosedException;
import org.mathparser.error.UnexpectedClosingBracketException;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Bracket Scanner Tests")
class BracketScannerTest {

    // ==================== Scanning ====================

    @Test
    @DisplayName("Plain spans and groups keep their positions")
    void testSegments() {
        ImmutableList<Segment> segments = BracketScanner.scan("2(x+1)[y]z", 0);

        assertEquals(Lists.immutable.of(
                Segment.plain("2", 0),
                Segment.group("x+1", 2),
                Segment.group("y", 7),
                Segment.plain("z", 9)), segments);
    }

    @Test
    @DisplayName("Nested brackets stay inside the outer group")
    void testNestedGroup() {
        ImmutableList<Segment> segments = BracketScanner.scan("(a(b)c)", 0);

        assertEquals(Lists.immutable.of(Segment.group("a(b)c", 1)), segments);
    }

    @Test
    @DisplayName("Empty group")
    void testEmptyGroup() {
        assertEquals(Lists.immutable.of(Segment.plain("f", 0), Segment.group("", 2)),
                BracketScanner.scan("f()", 0));
    }

    @Test
    @DisplayName("Errors are reported relative to the whole expression")
    void testOffset() {
        BracketsNotClosedException e = assertThrows(BracketsNotClosedException.class,
                () -> BracketScanner.scan("(1", 10));

        assertEquals(10, e.getStartPosition());
        assertEquals(12, e.getEndPosition());
    }

    @Test
    @DisplayName("Brackets close only their own kind")
    void testMismatchedKinds() {
        UnexpectedClosingBracketException e = assertThrows(UnexpectedClosingBracketException.class,
                () -> BracketScanner.scan("([1)]", 0));

        assertEquals(')', e.getBracket());
        assertEquals(3, e.getPosition());
    }

    @Test
    @DisplayName("Innermost unclosed bracket is reported")
    void testInnermostUnclosed() {
        BracketsNotClosedException e = assertThrows(BracketsNotClosedException.class,
                () -> BracketScanner.scan("([1", 0));

        assertEquals('[', e.getBracket());
        assertEquals(1, e.getStartPosition());
    }

    // ==================== Arguments ====================

    @Test
    @DisplayName("Commas of nested calls are kept")
    void testSplitArguments() {
        ImmutableList<Segment> pieces = BracketScanner.splitArguments("f(1,2),3", 5);

        assertEquals(Lists.immutable.of(Segment.plain("f(1,2)", 5), Segment.plain("3", 12)), pieces);
    }

    @Test
    @DisplayName("Empty group is a single blank piece")
    void testSplitEmpty() {
        assertEquals(Lists.immutable.of(Segment.plain("", 0)), BracketScanner.splitArguments("", 0));
    }
}
