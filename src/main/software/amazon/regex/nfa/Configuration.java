package software.amazon.regex.nfa;

/**
 * Configuration for an NfaCompiler.
 */
public class Configuration {

    public static final int DEFAULT_MAX_STATES = 1_000_000;

    /**
     * A repetition with a maximum but no minimum, such as the one produced for {@code a?}, is normally compiled as if
     * its minimum were 0. With strict bounds such a repetition is rejected with an
     * UnsupportedBoundCombinationException, for callers whose syntax trees are expected to always carry an explicit
     * minimum whenever a maximum is given.
     */
    private final boolean strictBounds;

    /**
     * Compiling a tree whose automaton would have more states than this fails with an AutomatonTooLargeException.
     * Bounded repetitions copy their sub-expression once per occurrence, so nested bounds multiply quickly.
     */
    private final int maxStates;

    private Configuration(boolean strictBounds, int maxStates) {
        this.strictBounds = strictBounds;
        this.maxStates = maxStates;
    }

    public boolean isStrictBounds() {
        return strictBounds;
    }

    public int getMaxStates() {
        return maxStates;
    }

    public static class Builder {

        private boolean strictBounds = false;
        private int maxStates = DEFAULT_MAX_STATES;

        public Builder withStrictBounds(boolean strictBounds) {
            this.strictBounds = strictBounds;
            return this;
        }

        public Builder withMaxStates(int maxStates) {
            if (maxStates < 1) {
                throw new IllegalArgumentException("An automaton has at least one state: " + maxStates);
            }
            this.maxStates = maxStates;
            return this;
        }

        public Configuration build() {
            return new Configuration(strictBounds, maxStates);
        }
    }
}
