package software.amazon.regex.nfa.input;

/**
 * The different kinds of input a Transition can consume.
 */
public enum InputType {
    BYTE,
    RANGE,
    WILDCARD
}
