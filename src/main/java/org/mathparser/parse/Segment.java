package org.mathparser.parse;

/**
 * A top-level span of an expression as found by {@link BracketScanner}.
 *
 * @param type   PLAIN for text outside brackets, GROUP for the inside of a bracket pair
 * @param text   The span text, without the enclosing brackets for a GROUP
 * @param offset Position of the first character of {@code text} in the whole expression
 */
record Segment(SegmentType type, String text, int offset) {

    enum SegmentType {
        PLAIN,
        GROUP
    }

    static Segment plain(String text, int offset) {
        return new Segment(SegmentType.PLAIN, text, offset);
    }

    static Segment group(String text, int offset) {
        return new Segment(SegmentType.GROUP, text, offset);
    }

    boolean isGroup() {
        return type == SegmentType.GROUP;
    }
}
