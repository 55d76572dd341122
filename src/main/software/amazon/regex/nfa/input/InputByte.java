package software.amazon.regex.nfa.input;

import static software.amazon.regex.nfa.input.InputType.BYTE;

/**
 * An input that matches exactly one byte value.
 */
public class InputByte extends TransitionInput {

    private final byte b;

    InputByte(final byte b) {
        this.b = b;
    }

    public static InputByte cast(TransitionInput input) {
        return (InputByte) input;
    }

    public byte getByte() {
        return b;
    }

    @Override
    public InputType getType() {
        return BYTE;
    }

    @Override
    public boolean accepts(final byte other) {
        return other == b;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        return ((InputByte) o).getByte() == getByte();
    }

    @Override
    public int hashCode() {
        return Byte.valueOf(b).hashCode();
    }

    @Override
    public String toString() {
        return byteToString(b);
    }
}
