package software.amazon.regex.nfa;

import software.amazon.regex.nfa.ast.AlternationNode;
import software.amazon.regex.nfa.ast.ConcatenationNode;
import software.amazon.regex.nfa.ast.LiteralNode;
import software.amazon.regex.nfa.ast.RangeNode;
import software.amazon.regex.nfa.ast.RegexNode;
import software.amazon.regex.nfa.ast.RegexNodeType;
import software.amazon.regex.nfa.ast.RepetitionNode;
import software.amazon.regex.nfa.input.TransitionInput;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds NFA fragments from syntax tree nodes with an extended Thompson construction.
 * <p>
 * Every build call follows the same contract: the caller supplies the state the fragment is entered from and the
 * allocator to take new states from; the call allocates whatever states it needs (including its exit), adds them and
 * their transitions to the accumulator, and returns the fragment together with the updated allocator. Fragments are
 * composed by building one from the exit of another, so no glue is needed for concatenation.
 * <p>
 * The builder itself holds no state. It expects a tree that AstValidator has accepted: ranges and bounds are not
 * re-checked here, except for the bound resolution that decides how a repetition is laid out.
 */
@Immutable
final class ThompsonBuilder {

    private final boolean strictBounds;

    ThompsonBuilder(final boolean strictBounds) {
        this.strictBounds = strictBounds;
    }

    /**
     * Build the fragment for a node.
     *
     * @param node        the node
     * @param accumulator receives the fragment's states and transitions
     * @param entry       the state the fragment is entered from; already in the accumulator
     * @param allocator   where new states come from
     * @return the fragment, entered at {@code entry}, and the allocator to continue with
     */
    Construction build(@Nonnull final RegexNode node, @Nonnull final NfaAccumulator accumulator, final int entry,
                       @Nonnull final StateAllocator allocator) {
        switch (node.getType()) {
            case LITERAL:
                return buildSingleStep(accumulator, entry, allocator,
                        TransitionInput.exactly(((LiteralNode) node).getValue()));
            case RANGE:
                final RangeNode range = (RangeNode) node;
                return buildSingleStep(accumulator, entry, allocator,
                        TransitionInput.between(range.getMin(), range.getMax()));
            case WILDCARD:
                return buildSingleStep(accumulator, entry, allocator, TransitionInput.any());
            case CONCATENATION:
                return buildConcatenation((ConcatenationNode) node, accumulator, entry, allocator);
            case ALTERNATION:
                return buildAlternation((AlternationNode) node, accumulator, entry, allocator);
            case REPETITION:
                return buildRepetition((RepetitionNode) node, accumulator, entry, allocator);
            default:
                throw new IllegalArgumentException("Unsupported node type " + node.getType());
        }
    }

    // entry --input--> exit
    private static Construction buildSingleStep(final NfaAccumulator accumulator, final int entry,
                                                final StateAllocator allocator, final TransitionInput input) {
        final StateAllocator.Allocation exit = allocateState(accumulator, allocator);
        accumulator.addTransition(entry, input, exit.state);
        return new Construction(new SubAutomaton(entry, exit.state), exit.allocator);
    }

    // sequences nest to the right as deep as they are long, so the right spine is walked with a loop
    private Construction buildConcatenation(final ConcatenationNode node, final NfaAccumulator accumulator,
                                            final int entry, final StateAllocator allocator) {
        Construction current = new Construction(new SubAutomaton(entry, entry), allocator);
        RegexNode next = node;
        while (next.getType() == RegexNodeType.CONCATENATION) {
            final ConcatenationNode concatenation = (ConcatenationNode) next;
            current = build(concatenation.getLeft(), accumulator, current.exit(), current.allocator);
            next = concatenation.getRight();
        }
        current = build(next, accumulator, current.exit(), current.allocator);
        return new Construction(new SubAutomaton(entry, current.exit()), current.allocator);
    }

    /*
     * Each branch gets its own gateway state to be built from, and both branches lead into one shared exit:
     *
     *            ε         L          ε
     *   entry ------> gL ----> xL ------> exit
     *     |                                 ^
     *     |      ε         R          ε     |
     *     +---------> gR ----> xR ----------+
     *
     * States are allocated as gL, L's states, gR, R's states, exit. When R is itself an alternation, as it is for every
     * level of a right-nested list of alternatives, its gateways come from the same loop and the exits are allocated
     * while unwinding, innermost first.
     */
    private Construction buildAlternation(final AlternationNode node, final NfaAccumulator accumulator,
                                          final int entry, final StateAllocator allocator) {
        final Deque<AlternationLevel> levels = new ArrayDeque<>();
        int levelEntry = entry;
        StateAllocator current = allocator;
        RegexNode next = node;
        while (next.getType() == RegexNodeType.ALTERNATION) {
            final AlternationNode alternation = (AlternationNode) next;
            final StateAllocator.Allocation leftGateway = allocateState(accumulator, current);
            final Construction left = build(alternation.getLeft(), accumulator, leftGateway.state,
                    leftGateway.allocator);
            final StateAllocator.Allocation rightGateway = allocateState(accumulator, left.allocator);
            levels.push(new AlternationLevel(levelEntry, leftGateway.state, left.exit(), rightGateway.state));
            levelEntry = rightGateway.state;
            current = rightGateway.allocator;
            next = alternation.getRight();
        }

        final Construction last = build(next, accumulator, levelEntry, current);
        int rightExit = last.exit();
        current = last.allocator;
        while (!levels.isEmpty()) {
            final AlternationLevel level = levels.pop();
            final StateAllocator.Allocation exit = allocateState(accumulator, current);
            accumulator.addEpsilonTransition(level.entry, level.leftGateway);
            accumulator.addEpsilonTransition(level.entry, level.rightGateway);
            accumulator.addEpsilonTransition(level.leftExit, exit.state);
            accumulator.addEpsilonTransition(rightExit, exit.state);
            rightExit = exit.state;
            current = exit.allocator;
        }
        return new Construction(new SubAutomaton(entry, rightExit), current);
    }

    /**
     * A repetition is built as its mandatory phase, the required occurrences chained one after the other, followed by
     * its optional phase, built from the mandatory phase's exit.
     */
    Construction buildRepetition(final RepetitionNode node, final NfaAccumulator accumulator, final int entry,
                                 final StateAllocator allocator) {
        final RepetitionBounds bounds = RepetitionBounds.resolve(node, strictBounds);
        final Construction mandatory = buildMandatoryPhase(node.getNode(), bounds.mandatory, accumulator, entry,
                allocator);

        final Construction optional;
        if (bounds.isUnbounded()) {
            optional = buildUnboundedPhase(node.getNode(), accumulator, mandatory.exit(), mandatory.allocator);
        } else {
            optional = buildBoundedPhase(node.getNode(), bounds.optional, accumulator, mandatory.exit(),
                    mandatory.allocator);
        }
        return new Construction(new SubAutomaton(entry, optional.exit()), optional.allocator);
    }

    /**
     * Chain exactly {@code count} independent copies of the sub-expression. With a count of 0 nothing is built and the
     * phase is left where it was entered.
     */
    Construction buildMandatoryPhase(final RegexNode sub, final int count, final NfaAccumulator accumulator,
                                     final int entry, final StateAllocator allocator) {
        Construction current = new Construction(new SubAutomaton(entry, entry), allocator);
        for (int i = 0; i < count; i++) {
            current = build(sub, accumulator, current.exit(), current.allocator);
        }
        return new Construction(new SubAutomaton(entry, current.exit()), current.allocator);
    }

    /**
     * One copy of the sub-expression with epsilon transitions both ways between its own entry and exit, so it can be
     * skipped or taken any number of times. The loop hangs off this copy's boundary: the last mandatory occurrence, if
     * any, stays mandatory.
     */
    Construction buildUnboundedPhase(final RegexNode sub, final NfaAccumulator accumulator, final int entry,
                                     final StateAllocator allocator) {
        final Construction instance = build(sub, accumulator, entry, allocator);
        accumulator.addEpsilonTransition(instance.fragment.entry, instance.exit());
        accumulator.addEpsilonTransition(instance.exit(), instance.fragment.entry);
        return instance;
    }

    /**
     * Up to {@code count} further copies of the sub-expression. A shared join state is allocated first and becomes the
     * phase's exit; the phase entry and the exit of every copy get an epsilon transition into it, so the phase can be
     * left after any number of copies from 0 to {@code count}. With a count of 0 nothing is built, not even the join
     * state.
     */
    Construction buildBoundedPhase(final RegexNode sub, final int count, final NfaAccumulator accumulator,
                                   final int entry, final StateAllocator allocator) {
        if (count == 0) {
            return new Construction(new SubAutomaton(entry, entry), allocator);
        }
        final StateAllocator.Allocation join = allocateState(accumulator, allocator);
        accumulator.addEpsilonTransition(entry, join.state);

        Construction current = new Construction(new SubAutomaton(entry, entry), join.allocator);
        for (int i = 0; i < count; i++) {
            current = build(sub, accumulator, current.exit(), current.allocator);
            accumulator.addEpsilonTransition(current.exit(), join.state);
        }
        return new Construction(new SubAutomaton(entry, join.state), current.allocator);
    }

    private static final class AlternationLevel {
        final int entry;
        final int leftGateway;
        final int leftExit;
        final int rightGateway;

        AlternationLevel(final int entry, final int leftGateway, final int leftExit, final int rightGateway) {
            this.entry = entry;
            this.leftGateway = leftGateway;
            this.leftExit = leftExit;
            this.rightGateway = rightGateway;
        }
    }

    private static StateAllocator.Allocation allocateState(final NfaAccumulator accumulator,
                                                           final StateAllocator allocator) {
        final StateAllocator.Allocation allocation = allocator.allocate();
        accumulator.addState(allocation.state);
        return allocation;
    }
}
