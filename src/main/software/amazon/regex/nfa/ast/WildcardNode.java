package software.amazon.regex.nfa.ast;

/**
 * Matches any single byte.
 */
public final class WildcardNode extends RegexNode {

    static final WildcardNode INSTANCE = new WildcardNode();

    private WildcardNode() { }

    @Override
    public RegexNodeType getType() {
        return RegexNodeType.WILDCARD;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WildcardNode;
    }

    @Override
    public int hashCode() {
        return WildcardNode.class.hashCode();
    }

    @Override
    public String toString() {
        return ".";
    }
}
