package software.amazon.regex.nfa;

/**
 * A repetition with a negative bound, or with a maximum less than its minimum.
 */
public class InvalidRepetitionBoundException extends NfaConstructionException {

    public InvalidRepetitionBoundException(String msg) {
        super(msg);
    }

}
