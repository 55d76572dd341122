package software.amazon.regex.nfa;

/**
 * A RuntimeException that indicates a syntax tree could not be turned into an NFA. Thrown before any part of the
 * automaton has been built.
 */
public class NfaConstructionException extends RuntimeException {

    public NfaConstructionException(String msg) {
        super(msg);
    }

}
