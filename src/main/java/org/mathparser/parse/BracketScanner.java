package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.mathparser.error.BracketsNotClosedException;
import org.mathparser.error.UnexpectedClosingBracketException;

/**
 * Splits an expression into top-level plain spans and bracket groups.
 *
 * Round and square brackets group the same way; they only have to be closed
 * by their own kind. Groups are returned unparsed, nested brackets included.
 */
final class BracketScanner {

    private static final String OPENING = "([";
    private static final String CLOSING = ")]";

    private BracketScanner() {
    }

    /**
     * @param text   The expression or sub-expression to scan
     * @param offset Position of {@code text} in the whole expression, used in errors
     */
    static ImmutableList<Segment> scan(String text, int offset) {
        MutableList<Segment> segments = Lists.mutable.empty();
        StringBuilder openKinds = new StringBuilder();
        int[] openPositions = new int[text.length()];
        int segmentStart = 0;

        for (int pos = 0; pos < text.length(); pos++) {
            char c = text.charAt(pos);
            int opening = OPENING.indexOf(c);
            int closing = CLOSING.indexOf(c);

            if (opening >= 0) {
                if (openKinds.length() == 0) {
                    if (pos > segmentStart) {
                        segments.add(Segment.plain(text.substring(segmentStart, pos), offset + segmentStart));
                    }
                    segmentStart = pos + 1;
                }
                openPositions[openKinds.length()] = pos;
                openKinds.append(c);
            } else if (closing >= 0) {
                int depth = openKinds.length();
                if (depth == 0 || openKinds.charAt(depth - 1) != OPENING.charAt(closing)) {
                    throw new UnexpectedClosingBracketException(c, offset + pos);
                }
                openKinds.setLength(depth - 1);
                if (depth == 1) {
                    segments.add(Segment.group(text.substring(segmentStart, pos), offset + segmentStart));
                    segmentStart = pos + 1;
                }
            }
        }

        int depth = openKinds.length();
        if (depth > 0) {
            throw new BracketsNotClosedException(openKinds.charAt(depth - 1),
                    offset + openPositions[depth - 1], offset + text.length());
        }

        if (segmentStart < text.length()) {
            segments.add(Segment.plain(text.substring(segmentStart), offset + segmentStart));
        }
        return segments.toImmutable();
    }

    /**
     * Splits the inside of a group on the commas of its own level, keeping
     * commas of nested groups in place. Pieces may be blank.
     */
    static ImmutableList<Segment> splitArguments(String group, int offset) {
        MutableList<Segment> pieces = Lists.mutable.empty();
        int depth = 0;
        int pieceStart = 0;

        for (int pos = 0; pos < group.length(); pos++) {
            char c = group.charAt(pos);
            if (OPENING.indexOf(c) >= 0) {
                depth++;
            } else if (CLOSING.indexOf(c) >= 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                pieces.add(Segment.plain(group.substring(pieceStart, pos), offset + pieceStart));
                pieceStart = pos + 1;
            }
        }

        pieces.add(Segment.plain(group.substring(pieceStart), offset + pieceStart));
        return pieces.toImmutable();
    }
}
