package org.mathparser.parse;

import org.mathparser.node.BinaryOperation;
import org.mathparser.node.FreeformCall;
import org.mathparser.node.MathNode;
import org.mathparser.node.UnaryOperation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Measures node trees without recursion, so that trees too deep to print or
 * evaluate are rejected before anything walks them recursively.
 */
final class TreeDepth {

    private record Entry(MathNode node, int depth) {
    }

    private TreeDepth() {
    }

    /**
     * Whether {@code node} has more than {@code limit} levels. A leaf has one level.
     */
    static boolean exceeds(MathNode node, int limit) {
        Deque<Entry> pending = new ArrayDeque<>();
        pending.push(new Entry(node, 1));

        while (!pending.isEmpty()) {
            Entry entry = pending.pop();
            if (entry.depth() > limit) {
                return true;
            }
            int childDepth = entry.depth() + 1;
            MathNode current = entry.node();
            if (current instanceof UnaryOperation unary) {
                pending.push(new Entry(unary.operand(), childDepth));
            } else if (current instanceof BinaryOperation binary) {
                pending.push(new Entry(binary.left(), childDepth));
                pending.push(new Entry(binary.right(), childDepth));
            } else if (current instanceof FreeformCall call) {
                call.arguments().forEach(argument -> pending.push(new Entry(argument, childDepth)));
            }
        }
        return false;
    }
}
