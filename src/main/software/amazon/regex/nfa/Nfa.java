package software.amazon.regex.nfa;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A nondeterministic finite automaton over bytes: states, input transitions, epsilon transitions, a start state and a
 * set of final states. States are plain integer identifiers. Nothing is precomputed: a consumer that needs epsilon
 * closures computes them itself, treating the epsilon transitions as a directed graph.
 * <p>
 * The constructor checks that the start state, every final state and every transition endpoint is one of the states.
 * Unique identifiers are guaranteed by how NfaCompiler allocates them, not by this class.
 */
@Immutable
@ThreadSafe
public final class Nfa {

    private final SortedSet<Integer> states;
    private final List<Transition> transitions;
    private final List<EpsilonTransition> epsilonTransitions;
    private final int startState;
    private final SortedSet<Integer> finalStates;

    public Nfa(@Nonnull final Collection<Integer> states,
               @Nonnull final List<Transition> transitions,
               @Nonnull final List<EpsilonTransition> epsilonTransitions,
               final int startState,
               @Nonnull final Collection<Integer> finalStates) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        this.epsilonTransitions = Collections.unmodifiableList(new ArrayList<>(epsilonTransitions));
        this.startState = startState;
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(finalStates));
        ensureClosed();
    }

    private void ensureClosed() {
        ensureState(startState, "Start state");
        for (Integer finalState : finalStates) {
            ensureState(finalState, "Final state");
        }
        for (Transition transition : transitions) {
            ensureState(transition.getSource(), "Source of " + transition);
            ensureState(transition.getDestination(), "Destination of " + transition);
        }
        for (EpsilonTransition epsilon : epsilonTransitions) {
            ensureState(epsilon.getSource(), "Source of " + epsilon);
            ensureState(epsilon.getDestination(), "Destination of " + epsilon);
        }
    }

    private void ensureState(final int state, final String what) {
        if (!states.contains(state)) {
            throw new IllegalArgumentException(what + " is not a state of the automaton: " + state);
        }
    }

    /**
     * Returns the states in ascending order.
     */
    public SortedSet<Integer> getStates() {
        return states;
    }

    /**
     * Returns the input transitions in the order in which they were created.
     */
    public List<Transition> getTransitions() {
        return transitions;
    }

    /**
     * Returns the epsilon transitions in the order in which they were created.
     */
    public List<EpsilonTransition> getEpsilonTransitions() {
        return epsilonTransitions;
    }

    public int getStartState() {
        return startState;
    }

    /**
     * Returns the final states in ascending order.
     */
    public SortedSet<Integer> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(final int state) {
        return finalStates.contains(state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Nfa other = (Nfa) o;
        return startState == other.startState &&
                states.equals(other.states) &&
                transitions.equals(other.transitions) &&
                epsilonTransitions.equals(other.epsilonTransitions) &&
                finalStates.equals(other.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, transitions, epsilonTransitions, startState, finalStates);
    }

    @Override
    public String toString() {
        return "Nfa{states=" + states.size() +
                ", transitions=" + transitions.size() +
                ", epsilonTransitions=" + epsilonTransitions.size() +
                ", start=" + startState +
                ", final=" + finalStates + '}';
    }
}
