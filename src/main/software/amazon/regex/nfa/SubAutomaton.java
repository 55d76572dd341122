package software.amazon.regex.nfa;

import javax.annotation.concurrent.Immutable;

/**
 * The boundary of a fragment that has just been built: where it is entered and where it is left. Fragments are
 * composed by building the next one from the previous one's exit.
 */
@Immutable
final class SubAutomaton {
    final int entry;
    final int exit;

    SubAutomaton(final int entry, final int exit) {
        this.entry = entry;
        this.exit = exit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SubAutomaton other = (SubAutomaton) o;
        return entry == other.entry && exit == other.exit;
    }

    @Override
    public int hashCode() {
        return 31 * entry + exit;
    }

    @Override
    public String toString() {
        return "(" + entry + ", " + exit + ")";
    }
}
