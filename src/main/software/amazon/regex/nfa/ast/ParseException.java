package software.amazon.regex.nfa.ast;

/**
 * A RuntimeException that indicates an error parsing a regular expression.
 */
public class ParseException extends RuntimeException {

    public ParseException(String msg) {
        super(msg);
    }

}
