package software.amazon.regex.nfa.ast;

/**
 * Matches any byte in [min, max], comparing unsigned. A node with min &gt; max can be created but will be rejected
 * before NFA construction.
 */
public final class RangeNode extends RegexNode {

    private final byte min;
    private final byte max;

    RangeNode(final byte min, final byte max) {
        this.min = min;
        this.max = max;
    }

    public byte getMin() {
        return min;
    }

    public byte getMax() {
        return max;
    }

    public boolean isValid() {
        return Byte.toUnsignedInt(min) <= Byte.toUnsignedInt(max);
    }

    @Override
    public RegexNodeType getType() {
        return RegexNodeType.RANGE;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeNode)) {
            return false;
        }
        RangeNode other = (RangeNode) o;
        return min == other.min && max == other.max;
    }

    @Override
    public int hashCode() {
        return 31 * Byte.hashCode(min) + Byte.hashCode(max);
    }

    @Override
    public String toString() {
        return "[" + byteToRegex(min) + "-" + byteToRegex(max) + "]";
    }
}
