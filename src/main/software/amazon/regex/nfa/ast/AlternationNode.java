package software.amazon.regex.nfa.ast;

import java.util.Objects;

/**
 * Matches left or right.
 */
public final class AlternationNode extends RegexNode {

    private final RegexNode left;
    private final RegexNode right;

    AlternationNode(final RegexNode left, final RegexNode right) {
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
        return RegexNodeType.ALTERNATION;
    }

    // a list of alternatives nests to the right, so the right spine is walked with a loop

    @Override
    public boolean equals(Object o) {
        RegexNode self = this;
        Object that = o;
        while (self instanceof AlternationNode) {
            if (!(that instanceof AlternationNode)) {
                return false;
            }
            AlternationNode a = (AlternationNode) self;
            AlternationNode b = (AlternationNode) that;
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
        int hash = RegexNodeType.ALTERNATION.hashCode();
        RegexNode current = this;
        while (current instanceof AlternationNode) {
            AlternationNode alternation = (AlternationNode) current;
            hash = 31 * hash + alternation.left.hashCode();
            current = alternation.right;
        }
        return 31 * hash + current.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        RegexNode current = this;
        while (current instanceof AlternationNode) {
            AlternationNode alternation = (AlternationNode) current;
            // only a left alternation needs its own group
            if (alternation.left.getType() == RegexNodeType.ALTERNATION) {
                sb.append('(').append(alternation.left).append(')');
            } else {
                sb.append(alternation.left);
            }
            sb.append('|');
            current = alternation.right;
        }
        return sb.append(current).toString();
    }
}
