package software.amazon.regex.nfa;

/**
 * The automaton for a syntax tree would have more states than the compiler is configured to allow.
 */
public class AutomatonTooLargeException extends NfaConstructionException {

    public AutomatonTooLargeException(String msg) {
        super(msg);
    }

}
