package org.mathparser.parse;

import org.eclipse.collections.api.list.ImmutableList;
import org.mathparser.node.MathNode;

import java.util.Objects;

/**
 * One element of the sequence the resolution passes fold into a single node.
 *
 * Type hierarchy:
 * Part
 * ├── Text (a word or operator not consumed yet)
 * ├── Resolved (a finished node)
 * └── Arguments (a bracket group holding zero or several comma-separated nodes)
 */
sealed interface Part permits Part.Text, Part.Resolved, Part.Arguments {

    String describe();

    record Text(String text) implements Part {

        private static final String OPERATORS = "+-^/*";

        public Text {
            Objects.requireNonNull(text, "Text cannot be null");
        }

        boolean is(String value) {
            return text.equals(value);
        }

        boolean isOperator() {
            return text.length() == 1 && OPERATORS.contains(text);
        }

        @Override
        public String describe() {
            return text;
        }
    }

    record Resolved(MathNode node) implements Part {

        public Resolved {
            Objects.requireNonNull(node, "Node cannot be null");
        }

        @Override
        public String describe() {
            return node.toString();
        }
    }

    record Arguments(ImmutableList<MathNode> nodes) implements Part {

        @Override
        public String describe() {
            return nodes.makeString("ARG_LIST[", ", ", "]");
        }
    }
}
