package software.amazon.regex.nfa;

import software.amazon.regex.nfa.input.TransitionInput;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * The states and transitions of an NFA under construction. Owned by exactly one in-flight build; construction calls
 * only ever add to it. Transitions keep the order in which they were added, states are kept in ascending order.
 */
@NotThreadSafe
final class NfaAccumulator {

    private final TreeSet<Integer> states = new TreeSet<>();
    private final Set<Transition> transitions = new LinkedHashSet<>();
    private final Set<EpsilonTransition> epsilonTransitions = new LinkedHashSet<>();

    void addState(final int state) {
        states.add(state);
    }

    void addTransition(final int source, final TransitionInput input, final int destination) {
        transitions.add(new Transition(source, input, destination));
    }

    void addEpsilonTransition(final int source, final int destination) {
        epsilonTransitions.add(new EpsilonTransition(source, destination));
    }

    int stateCount() {
        return states.size();
    }

    int transitionCount() {
        return transitions.size();
    }

    int epsilonTransitionCount() {
        return epsilonTransitions.size();
    }

    /**
     * Freeze what has been accumulated into an NFA. The accumulator may not be used afterwards.
     */
    Nfa toNfa(final int startState, final int finalState) {
        return new Nfa(states, new ArrayList<>(transitions), new ArrayList<>(epsilonTransitions), startState,
                Collections.singleton(finalState));
    }
}
