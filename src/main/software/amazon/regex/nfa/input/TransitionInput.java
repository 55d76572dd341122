package software.amazon.regex.nfa.input;

import javax.annotation.concurrent.Immutable;

/**
 * The input specifier of a Transition: what must be consumed to move from the source state to the destination state.
 * Subclasses render themselves with {@link #toString()} in the form used as a diagram label.
 */
@Immutable
public abstract class TransitionInput {

    /**
     * Get the type of this input.
     *
     * @return The type.
     */
    public abstract InputType getType();

    /**
     * Tell if the given byte can be consumed by a transition carrying this input.
     *
     * @param b The byte.
     * @return True if and only if this input accepts the byte.
     */
    public abstract boolean accepts(byte b);

    public static InputByte exactly(final byte b) {
        return new InputByte(b);
    }

    public static InputRange between(final byte min, final byte max) {
        return new InputRange(min, max);
    }

    public static InputWildcard any() {
        return InputWildcard.INSTANCE;
    }

    /**
     * Render a single byte the way it appears in labels: printable ASCII as the character itself, everything else
     * (and the characters that need escaping in a label) in hex.
     */
    static String byteToString(final byte b) {
        int value = Byte.toUnsignedInt(b);
        if (value > 0x20 && value < 0x7F && value != '"' && value != '\\') {
            return String.valueOf((char) value);
        }
        return String.format("0x%02X", value);
    }
}
