package software.amazon.regex.nfa.ast;

import java.util.Objects;

/**
 * Matches left, then right.
 */
public final class ConcatenationNode extends RegexNode {

    private final RegexNode left;
    private final RegexNode right;

    ConcatenationNode(final RegexNode left, final RegexNode right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public RegexNode getLeft() {
        return left;
    }

    public RegexNode getRight() {
        return right;
    }

    @Override
    public RegexNodeType getType() {
        return RegexNodeType.CONCATENATION;
    }

    // equality, hashing and rendering walk the right spine with a loop, since it is as deep as the sequence is long

    @Override
    public boolean equals(Object o) {
        RegexNode self = this;
        Object that = o;
        while (self instanceof ConcatenationNode) {
            if (!(that instanceof ConcatenationNode)) {
                return false;
            }
            ConcatenationNode a = (ConcatenationNode) self;
            ConcatenationNode b = (ConcatenationNode) that;
            if (!a.left.equals(b.left)) {
                return false;
            }
            self = a.right;
            that = b.right;
        }
        return self.equals(that);
    }

    @Override
    public int hashCode() {
        int hash = RegexNodeType.CONCATENATION.hashCode();
        RegexNode current = this;
        while (current instanceof ConcatenationNode) {
            ConcatenationNode concatenation = (ConcatenationNode) current;
            hash = 31 * hash + concatenation.left.hashCode();
            current = concatenation.right;
        }
        return 31 * hash + current.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        RegexNode current = this;
        while (current instanceof ConcatenationNode) {
            ConcatenationNode concatenation = (ConcatenationNode) current;
            sb.append(group(concatenation.left));
            current = concatenation.right;
        }
        return sb.append(group(current)).toString();
    }

    private static String group(final RegexNode node) {
        return node.getType() == RegexNodeType.ALTERNATION ? "(" + node + ")" : node.toString();
    }
}
