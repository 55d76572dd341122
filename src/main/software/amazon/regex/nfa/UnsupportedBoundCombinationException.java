package software.amazon.regex.nfa;

/**
 * A repetition with a maximum but no minimum, rejected because the compiler was configured with strict bounds.
 */
public class UnsupportedBoundCombinationException extends NfaConstructionException {

    public UnsupportedBoundCombinationException(String msg) {
        super(msg);
    }

}
