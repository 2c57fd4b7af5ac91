package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.mathparser.error.ExpressionTooDeepException;
import org.mathparser.error.MissingOperatorOperandException;
import org.mathparser.node.MathComparison;
import org.mathparser.node.MathExpression;

/**
 * Parses equations and inequalities: sides separated by =, &lt;, &gt;, &lt;= or &gt;=.
 *
 * Only operators outside brackets split the expression. Each side is parsed
 * by {@link ExpressionResolver}; comparisons chain left to right, so
 * {@code a < b = c} is {@code (a < b) = c}. Chains longer than the
 * configured tree depth are rejected.
 */
final class ComparisonParser {

    private record Piece(String text, int offset, boolean operator) {
    }

    private ComparisonParser() {
    }

    static MathExpression parse(String expression, ExpressionResolver resolver) {
        ImmutableList<Piece> pieces = split(expression);

        if (pieces.noneSatisfy(Piece::operator)) {
            return resolver.resolve(expression, 0);
        }

        int limit = resolver.maxTreeDepth();
        if (pieces.count(Piece::operator) > limit) {
            int position = pieces.select(Piece::operator).get(limit).offset();
            throw new ExpressionTooDeepException("Comparisons are chained", limit, position);
        }

        MathExpression result = null;
        for (int i = 0; i < pieces.size(); i++) {
            Piece piece = pieces.get(i);
            if (!piece.operator()) {
                result = resolver.resolve(piece.text(), piece.offset());
                continue;
            }

            if (result == null || i + 1 == pieces.size() || pieces.get(i + 1).operator()) {
                throw new MissingOperatorOperandException(piece.text());
            }

            Piece right = pieces.get(i + 1);
            result = new MathComparison(
                    result,
                    MathComparison.Operator.fromSymbol(piece.text()),
                    resolver.resolve(right.text(), right.offset()));
            i++;
        }

        return result;
    }

    /**
     * Splits on top-level relational operators. Blank sides are dropped so
     * that an operator without a side is reported as missing an operand.
     */
    private static ImmutableList<Piece> split(String expression) {
        MutableList<Piece> pieces = Lists.mutable.empty();
        int depth = 0;
        int sideStart = 0;

        for (int pos = 0; pos < expression.length(); pos++) {
            char c = expression.charAt(pos);
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (depth == 0 && (c == '=' || c == '<' || c == '>')) {
                addSide(pieces, expression.substring(sideStart, pos), sideStart);
                int length = c != '=' && pos + 1 < expression.length() && expression.charAt(pos + 1) == '=' ? 2 : 1;
                pieces.add(new Piece(expression.substring(pos, pos + length), pos, true));
                pos += length - 1;
                sideStart = pos + 1;
            }
        }

        addSide(pieces, expression.substring(sideStart), sideStart);
        return pieces.toImmutable();
    }

    private static void addSide(MutableList<Piece> pieces, String side, int offset) {
        if (!side.isBlank()) {
            pieces.add(new Piece(side, offset, false));
        }
    }
}
