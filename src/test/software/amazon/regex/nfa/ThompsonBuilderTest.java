package software.amazon.regex.nfa;

import org.junit.Before;
import org.junit.Test;
import software.amazon.regex.nfa.ast.RegexNode;
import software.amazon.regex.nfa.input.TransitionInput;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static software.amazon.regex.nfa.ast.RegexNode.concat;
import static software.amazon.regex.nfa.ast.RegexNode.literal;
import static software.amazon.regex.nfa.ast.RegexNode.or;
import static software.amazon.regex.nfa.ast.RegexNode.range;
import static software.amazon.regex.nfa.ast.RegexNode.repeat;
import static software.amazon.regex.nfa.ast.RegexNode.wildcard;

/**
 * Builds single fragments from an arbitrary entry state, the way a parent fragment would.
 */
public class ThompsonBuilderTest {

    private static final int ENTRY = 7;

    private ThompsonBuilder builder;
    private NfaAccumulator accumulator;
    private StateAllocator allocator;

    @Before
    public void setUp() {
        builder = new ThompsonBuilder(false);
        accumulator = new NfaAccumulator();
        accumulator.addState(ENTRY);
        allocator = StateAllocator.startingAt(ENTRY + 1);
    }

    private Nfa freeze(final Construction construction) {
        return accumulator.toNfa(ENTRY, construction.exit());
    }

    @Test
    public void testLiteralAllocatesOneExitState() {
        Construction construction = builder.build(literal((byte) 'a'), accumulator, ENTRY, allocator);

        assertEquals(new SubAutomaton(ENTRY, 8), construction.fragment);
        assertEquals(StateAllocator.startingAt(9), construction.allocator);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(7, 8), new ArrayList<>(nfa.getStates()));
        assertEquals(Collections.singletonList(new Transition(7, TransitionInput.exactly((byte) 'a'), 8)),
                nfa.getTransitions());
        assertTrue(nfa.getEpsilonTransitions().isEmpty());
    }

    @Test
    public void testRangeCarriesItsBounds() {
        Construction construction = builder.build(range((byte) '0', (byte) '9'), accumulator, ENTRY, allocator);

        assertEquals(Collections.singletonList(
                new Transition(7, TransitionInput.between((byte) '0', (byte) '9'), 8)),
                freeze(construction).getTransitions());
    }

    @Test
    public void testWildcard() {
        Construction construction = builder.build(wildcard(), accumulator, ENTRY, allocator);

        assertEquals(Collections.singletonList(new Transition(7, TransitionInput.any(), 8)),
                freeze(construction).getTransitions());
    }

    @Test
    public void testConcatenationChainsWithoutEpsilons() {
        Construction construction = builder.build(concat(literal((byte) 'a'), literal((byte) 'b')), accumulator,
                ENTRY, allocator);

        assertEquals(new SubAutomaton(ENTRY, 9), construction.fragment);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(7, TransitionInput.exactly((byte) 'a'), 8),
                new Transition(8, TransitionInput.exactly((byte) 'b'), 9)), nfa.getTransitions());
        assertTrue(nfa.getEpsilonTransitions().isEmpty());
    }

    @Test
    public void testAlternationAllocatesGatewaysAndSharedExit() {
        Construction construction = builder.build(or(literal((byte) 'a'), literal((byte) 'b')), accumulator,
                ENTRY, allocator);

        // 8 = left gateway, 9 = left exit, 10 = right gateway, 11 = right exit, 12 = shared exit
        assertEquals(new SubAutomaton(ENTRY, 12), construction.fragment);
        assertEquals(StateAllocator.startingAt(13), construction.allocator);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(8, TransitionInput.exactly((byte) 'a'), 9),
                new Transition(10, TransitionInput.exactly((byte) 'b'), 11)), nfa.getTransitions());
        assertEquals(Arrays.asList(
                new EpsilonTransition(7, 8),
                new EpsilonTransition(7, 10),
                new EpsilonTransition(9, 12),
                new EpsilonTransition(11, 12)), nfa.getEpsilonTransitions());
    }

    @Test
    public void testAlternativeListAllocatesExitsInnermostFirst() {
        RegexNode node = or(literal((byte) 'a'), or(literal((byte) 'b'), literal((byte) 'c')));
        Construction construction = builder.build(node, accumulator, ENTRY, allocator);

        // 8/9 = a's gateway and exit, 10 = gateway to b|c, 11/12 and 13/14 = b and c, 15 = exit of b|c, 16 = exit
        assertEquals(new SubAutomaton(ENTRY, 16), construction.fragment);
        assertEquals(StateAllocator.startingAt(17), construction.allocator);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(8, TransitionInput.exactly((byte) 'a'), 9),
                new Transition(11, TransitionInput.exactly((byte) 'b'), 12),
                new Transition(13, TransitionInput.exactly((byte) 'c'), 14)), nfa.getTransitions());
        assertEquals(Arrays.asList(
                new EpsilonTransition(10, 11),
                new EpsilonTransition(10, 13),
                new EpsilonTransition(12, 15),
                new EpsilonTransition(14, 15),
                new EpsilonTransition(7, 8),
                new EpsilonTransition(7, 10),
                new EpsilonTransition(9, 16),
                new EpsilonTransition(15, 16)), nfa.getEpsilonTransitions());
    }

    @Test
    public void testAlternationInsideSequence() {
        RegexNode node = concat(literal((byte) 'x'), concat(or(literal((byte) 'a'), literal((byte) 'b')),
                literal((byte) 'y')));
        Construction construction = builder.build(node, accumulator, ENTRY, allocator);

        // 8 = after x, 9..13 = a|b, 14 = after y
        assertEquals(new SubAutomaton(ENTRY, 14), construction.fragment);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(7, TransitionInput.exactly((byte) 'x'), 8),
                new Transition(9, TransitionInput.exactly((byte) 'a'), 10),
                new Transition(11, TransitionInput.exactly((byte) 'b'), 12),
                new Transition(13, TransitionInput.exactly((byte) 'y'), 14)), nfa.getTransitions());
        assertEquals(Arrays.asList(
                new EpsilonTransition(8, 9),
                new EpsilonTransition(8, 11),
                new EpsilonTransition(10, 13),
                new EpsilonTransition(12, 13)), nfa.getEpsilonTransitions());
    }

    @Test
    public void testMandatoryPhaseOfZeroIsANoOp() {
        Construction construction = builder.buildMandatoryPhase(literal((byte) 'a'), 0, accumulator, ENTRY,
                allocator);

        assertEquals(new SubAutomaton(ENTRY, ENTRY), construction.fragment);
        assertEquals(allocator, construction.allocator);
        assertEquals(1, accumulator.stateCount());
        assertEquals(0, accumulator.transitionCount());
    }

    @Test
    public void testMandatoryPhaseChainsCopies() {
        Construction construction = builder.buildMandatoryPhase(literal((byte) 'a'), 3, accumulator, ENTRY,
                allocator);

        assertEquals(new SubAutomaton(ENTRY, 10), construction.fragment);
        assertEquals(3, accumulator.transitionCount());
        assertEquals(0, accumulator.epsilonTransitionCount());
    }

    @Test
    public void testUnboundedPhaseLoopsOnItsOwnInstance() {
        Construction construction = builder.buildUnboundedPhase(literal((byte) 'a'), accumulator, ENTRY, allocator);

        assertEquals(new SubAutomaton(ENTRY, 8), construction.fragment);
        assertEquals(Arrays.asList(new EpsilonTransition(7, 8), new EpsilonTransition(8, 7)),
                freeze(construction).getEpsilonTransitions());
    }

    @Test
    public void testBoundedPhaseJoinsEveryOccurrence() {
        Construction construction = builder.buildBoundedPhase(literal((byte) 'a'), 2, accumulator, ENTRY, allocator);

        // 8 = join, 9 and 10 = exits of the two optional copies
        assertEquals(new SubAutomaton(ENTRY, 8), construction.fragment);
        assertEquals(StateAllocator.startingAt(11), construction.allocator);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(7, TransitionInput.exactly((byte) 'a'), 9),
                new Transition(9, TransitionInput.exactly((byte) 'a'), 10)), nfa.getTransitions());
        assertEquals(Arrays.asList(
                new EpsilonTransition(7, 8),
                new EpsilonTransition(9, 8),
                new EpsilonTransition(10, 8)), nfa.getEpsilonTransitions());
    }

    @Test
    public void testBoundedPhaseOfZeroHasNoJoinState() {
        Construction construction = builder.buildBoundedPhase(literal((byte) 'a'), 0, accumulator, ENTRY, allocator);

        assertEquals(new SubAutomaton(ENTRY, ENTRY), construction.fragment);
        assertEquals(1, accumulator.stateCount());
        assertEquals(0, accumulator.epsilonTransitionCount());
    }

    @Test
    public void testRepetitionBuildsMandatoryThenOptional() {
        RegexNode node = repeat(literal((byte) 'a'), 1, 2);
        Construction construction = builder.build(node, accumulator, ENTRY, allocator);

        // 8 = mandatory exit, 9 = join, 10 = optional copy exit
        assertEquals(new SubAutomaton(ENTRY, 9), construction.fragment);
        Nfa nfa = freeze(construction);
        assertEquals(Arrays.asList(
                new Transition(7, TransitionInput.exactly((byte) 'a'), 8),
                new Transition(8, TransitionInput.exactly((byte) 'a'), 10)), nfa.getTransitions());
        assertEquals(Arrays.asList(
                new EpsilonTransition(8, 9),
                new EpsilonTransition(10, 9)), nfa.getEpsilonTransitions());
    }

    @Test
    public void testSameInputsGiveSameFragment() {
        RegexNode node = concat(or(literal((byte) 'a'), wildcard()), repeat(range((byte) 'a', (byte) 'f'), 1, 3));

        NfaAccumulator other = new NfaAccumulator();
        other.addState(ENTRY);
        Construction first = builder.build(node, accumulator, ENTRY, allocator);
        Construction second = builder.build(node, other, ENTRY, allocator);

        assertEquals(first.fragment, second.fragment);
        assertEquals(first.allocator, second.allocator);
        assertEquals(accumulator.toNfa(ENTRY, first.exit()), other.toNfa(ENTRY, second.exit()));
    }
}
