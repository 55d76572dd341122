package software.amazon.regex.nfa.ast;

/**
 * Matches one exact byte.
 */
public final class LiteralNode extends RegexNode {

    private final byte value;

    LiteralNode(final byte value) {
        this.value = value;
    }

    public byte getValue() {
        return value;
    }

    @Override
    public RegexNodeType getType() {
        return RegexNodeType.LITERAL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNode && ((LiteralNode) o).value == value;
    }

    @Override
    public int hashCode() {
        return Byte.hashCode(value);
    }

    @Override
    public String toString() {
        return byteToRegex(value);
    }
}
