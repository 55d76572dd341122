package software.amazon.regex.nfa;

import javax.annotation.concurrent.Immutable;

/**
 * A move from one state to another that consumes no input.
 */
@Immutable
public final class EpsilonTransition {

    private final int source;
    private final int destination;

    public EpsilonTransition(final int source, final int destination) {
        this.source = source;
        this.destination = destination;
    }

    public int getSource() {
        return source;
    }

    public int getDestination() {
        return destination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EpsilonTransition other = (EpsilonTransition) o;
        return source == other.source && destination == other.destination;
    }

    @Override
    public int hashCode() {
        return 31 * source + destination;
    }

    @Override
    public String toString() {
        return source + " --ε--> " + destination;
    }
}
