package software.amazon.regex.nfa.input;

import static software.amazon.regex.nfa.input.InputType.WILDCARD;

/**
 * An input that matches any single byte.
 */
public class InputWildcard extends TransitionInput {

    static final InputWildcard INSTANCE = new InputWildcard();

    InputWildcard() { }

    @Override
    public InputType getType() {
        return WILDCARD;
    }

    @Override
    public boolean accepts(final byte b) {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return InputWildcard.class.hashCode();
    }

    @Override
    public String toString() {
        return "any";
    }
}
