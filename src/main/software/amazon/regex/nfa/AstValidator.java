package software.amazon.regex.nfa;

import software.amazon.regex.nfa.ast.AlternationNode;
import software.amazon.regex.nfa.ast.ConcatenationNode;
import software.amazon.regex.nfa.ast.RangeNode;
import software.amazon.regex.nfa.ast.RegexNode;
import software.amazon.regex.nfa.ast.RegexNodeType;
import software.amazon.regex.nfa.ast.RepetitionNode;

import javax.annotation.concurrent.Immutable;

/**
 * Checks a syntax tree before any of it is built, so a tree that cannot be compiled never leaves a partially built
 * automaton behind. Along the way it works out exactly how many states the construction will allocate, which is what
 * the state limit is enforced against.
 */
@Immutable
final class AstValidator {

    // counts are capped just above the largest possible limit so arithmetic on them can't overflow a long
    private static final long COUNT_CAP = (long) Integer.MAX_VALUE + 1;

    private final boolean strictBounds;
    private final int maxStates;

    AstValidator(final Configuration configuration) {
        this.strictBounds = configuration.isStrictBounds();
        this.maxStates = configuration.getMaxStates();
    }

    /**
     * Validate a tree.
     *
     * @param root the root of the tree
     * @return the number of states the automaton for the tree will have, including its start state
     * @throws InvalidRangeException if a range's minimum is greater than its maximum
     * @throws InvalidRepetitionBoundException if a repetition bound is negative or its maximum is below its minimum
     * @throws UnsupportedBoundCombinationException if strict bounds are configured and a repetition has only a maximum
     * @throws AutomatonTooLargeException if the automaton would have more states than configured
     */
    int validate(final RegexNode root) {
        final long states = 1 + countStates(root);
        if (states > maxStates) {
            throw new AutomatonTooLargeException(String.format(
                    "Automaton would need %s states, more than the limit of %d",
                    states >= COUNT_CAP ? "over " + Integer.MAX_VALUE : String.valueOf(states), maxStates));
        }
        return (int) states;
    }

    /**
     * The number of states a build of the node allocates. Its entry state is supplied by the caller and not counted.
     */
    long countStates(final RegexNode node) {
        switch (node.getType()) {
            case LITERAL:
            case WILDCARD:
                return 1;
            case RANGE:
                final RangeNode range = (RangeNode) node;
                if (!range.isValid()) {
                    throw new InvalidRangeException("Range minimum is greater than its maximum: " + range);
                }
                return 1;
            case CONCATENATION:
                return countConcatenationStates((ConcatenationNode) node);
            case ALTERNATION:
                return countAlternationStates((AlternationNode) node);
            case REPETITION:
                return countRepetitionStates((RepetitionNode) node);
            default:
                throw new IllegalArgumentException("Unsupported node type " + node.getType());
        }
    }

    // sequences and alternatives nest to the right as deep as they are long, so right spines are walked with a loop
    private long countConcatenationStates(final ConcatenationNode node) {
        long count = 0;
        RegexNode current = node;
        while (current.getType() == RegexNodeType.CONCATENATION) {
            final ConcatenationNode concatenation = (ConcatenationNode) current;
            count = add(count, countStates(concatenation.getLeft()));
            current = concatenation.getRight();
        }
        return add(count, countStates(current));
    }

    private long countAlternationStates(final AlternationNode node) {
        long count = 0;
        RegexNode current = node;
        while (current.getType() == RegexNodeType.ALTERNATION) {
            final AlternationNode alternation = (AlternationNode) current;
            // two gateways and the shared exit
            count = add(count, add(countStates(alternation.getLeft()), 3));
            current = alternation.getRight();
        }
        return add(count, countStates(current));
    }

    private long countRepetitionStates(final RepetitionNode node) {
        final RepetitionBounds bounds = RepetitionBounds.resolve(node, strictBounds);
        final long sub = countStates(node.getNode());
        final long mandatory = multiply(sub, bounds.mandatory);
        if (bounds.isUnbounded()) {
            return add(mandatory, sub);
        }
        if (bounds.optional == 0) {
            return mandatory;
        }
        // the join state plus the optional copies
        return add(mandatory, add(1, multiply(sub, bounds.optional)));
    }

    private static long add(final long a, final long b) {
        return Math.min(a + b, COUNT_CAP);
    }

    private static long multiply(final long a, final long b) {
        return Math.min(a * b, COUNT_CAP);
    }
}
