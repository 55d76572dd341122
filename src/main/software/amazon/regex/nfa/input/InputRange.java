package software.amazon.regex.nfa.input;

import static software.amazon.regex.nfa.input.InputType.RANGE;

/**
 * An input that matches any byte in the inclusive range [min, max]. Bytes are compared as unsigned values, so the
 * range 0x00-0xFF covers every byte. The caller guarantees min &lt;= max; the range itself does not re-validate.
 */
public class InputRange extends TransitionInput {

    private final byte min;
    private final byte max;

    InputRange(final byte min, final byte max) {
        this.min = min;
        this.max = max;
    }

    public static InputRange cast(TransitionInput input) {
        return (InputRange) input;
    }

    public byte getMin() {
        return min;
    }

    public byte getMax() {
        return max;
    }

    @Override
    public InputType getType() {
        return RANGE;
    }

    @Override
    public boolean accepts(final byte b) {
        int value = Byte.toUnsignedInt(b);
        return value >= Byte.toUnsignedInt(min) && value <= Byte.toUnsignedInt(max);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        InputRange other = (InputRange) o;
        return min == other.min && max == other.max;
    }

    @Override
    public int hashCode() {
        return 31 * Byte.hashCode(min) + Byte.hashCode(max);
    }

    @Override
    public String toString() {
        return byteToString(min) + '-' + byteToString(max);
    }
}
