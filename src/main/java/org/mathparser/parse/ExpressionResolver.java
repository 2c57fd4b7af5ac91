package org.mathparser.parse;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.mathparser.error.ExpressionTooDeepException;
import org.mathparser.node.Constant;
import org.mathparser.node.MathNode;

import java.util.logging.Logger;

/**
 * Turns an expression string into a node with a fixed set of options.
 *
 * Bracket groups are resolved first, recursively and one comma-separated piece
 * at a time; the plain spans around them are tokenized; the resulting part
 * sequence then goes through {@link ResolutionPasses}. Both bracket nesting
 * and the depth of the resulting node tree are capped.
 */
final class ExpressionResolver {

    private static final Logger LOGGER = Logger.getLogger(ExpressionResolver.class.getName());

    private final ParserOptions options;
    private final ImmutableList<String> vocabulary;

    ExpressionResolver(ParserOptions options) {
        this.options = options;
        this.vocabulary = buildVocabulary(options);
    }

    int maxTreeDepth() {
        return options.maxTreeDepth();
    }

    /**
     * @param text   The expression or a piece of it
     * @param offset Position of {@code text} in the string the caller parses
     */
    MathNode resolve(String text, int offset) {
        return resolve(text, offset, 0);
    }

    private MathNode resolve(String text, int offset, int depth) {
        ImmutableList<Part> parts = toParts(text, offset, depth);

        parts = ResolutionPasses.substituteVariables(parts, options.variableNames());
        parts = ResolutionPasses.applyFunctions(parts, options.customFunctions());
        parts = ResolutionPasses.applyUnaryMinus(parts);
        parts = ResolutionPasses.applyPower(parts);
        if (options.implicitMultiplication()) {
            parts = ResolutionPasses.applyImplicitMultiplication(parts);
        }
        parts = ResolutionPasses.applyMultiplicative(parts);
        parts = ResolutionPasses.applyAdditive(parts, options.minusNegativeFunction());

        checkTreeDepth(parts, offset);
        return ResolutionPasses.finish(parts);
    }

    /**
     * Rejects nodes nested deeper than {@code maxTreeDepth} before anything
     * prints or evaluates them recursively.
     */
    private void checkTreeDepth(ImmutableList<Part> parts, int offset) {
        for (Part part : parts) {
            if (part instanceof Part.Resolved resolved
                    && TreeDepth.exceeds(resolved.node(), options.maxTreeDepth())) {
                throw new ExpressionTooDeepException("Operations are nested", options.maxTreeDepth(), offset);
            }
        }
    }

    private ImmutableList<Part> toParts(String text, int offset, int depth) {
        MutableList<Part> parts = Lists.mutable.empty();

        for (Segment segment : BracketScanner.scan(text, offset)) {
            if (segment.isGroup()) {
                parts.add(resolveGroup(segment, depth + 1));
                continue;
            }
            for (Token token : new MathLexer(segment.text(), segment.offset(), vocabulary).tokenize()) {
                parts.add(token.type() == Token.TokenType.NUMBER
                        ? new Part.Resolved(new Constant(Double.parseDouble(token.value())))
                        : new Part.Text(token.value()));
            }
        }

        return parts.toImmutable();
    }

    private Part resolveGroup(Segment group, int depth) {
        if (depth > options.maxNestingDepth()) {
            throw new ExpressionTooDeepException(options.maxNestingDepth(), group.offset() - 1);
        }
        LOGGER.finer(() -> "Resolving group '" + group.text() + "' at depth " + depth);

        MutableList<MathNode> arguments = Lists.mutable.empty();
        for (Segment piece : BracketScanner.splitArguments(group.text(), group.offset())) {
            if (!piece.text().isBlank()) {
                arguments.add(resolve(piece.text(), piece.offset(), depth));
            }
        }

        if (arguments.size() == 1) {
            return new Part.Resolved(arguments.getFirst());
        }
        return new Part.Arguments(arguments.toImmutable());
    }

    /**
     * Every word the lexer must recognise, longest first.
     */
    private static ImmutableList<String> buildVocabulary(ParserOptions options) {
        MutableList<String> words = Lists.mutable.empty();
        options.customFunctions().definitions().forEach(definition -> words.add(definition.name()));
        words.addAllIterable(BuiltIns.VARIABLES);
        words.addAllIterable(BuiltIns.FUNCTIONS);
        words.addAll(options.variableNames());

        return words.distinct()
                .sortThis((a, b) -> Integer.compare(b.length(), a.length()))
                .toImmutable();
    }
}
