package software.amazon.regex.nfa;

/**
 * A byte range whose minimum is greater than its maximum.
 */
public class InvalidRangeException extends NfaConstructionException {

    public InvalidRangeException(String msg) {
        super(msg);
    }

}
