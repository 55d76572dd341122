package software.amazon.regex.nfa;

import software.amazon.regex.nfa.input.TransitionInput;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A move from one state to another that consumes one byte accepted by the input.
 */
@Immutable
public final class Transition {

    private final int source;
    private final TransitionInput input;
    private final int destination;

    public Transition(final int source, @Nonnull final TransitionInput input, final int destination) {
        this.source = source;
        this.input = Objects.requireNonNull(input, "input");
        this.destination = destination;
    }

    public int getSource() {
        return source;
    }

    public TransitionInput getInput() {
        return input;
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
        Transition other = (Transition) o;
        return source == other.source && destination == other.destination && input.equals(other.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, input, destination);
    }

    @Override
    public String toString() {
        return source + " --" + input + "--> " + destination;
    }
}
