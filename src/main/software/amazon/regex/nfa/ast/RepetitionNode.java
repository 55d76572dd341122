package software.amazon.regex.nfa.ast;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Matches between min and max occurrences of a sub-expression. Either bound may be absent (null); an absent max
 * means there is no upper bound. Bounds are not checked here: negative or inverted bounds are rejected before NFA
 * construction.
 */
public final class RepetitionNode extends RegexNode {

    private final RegexNode node;
    private final Integer min;
    private final Integer max;

    RepetitionNode(final RegexNode node, @Nullable final Integer min, @Nullable final Integer max) {
        this.node = Objects.requireNonNull(node, "node");
        this.min = min;
        this.max = max;
    }

    public RegexNode getNode() {
        return node;
    }

    @Nullable
    public Integer getMin() {
        return min;
    }

    @Nullable
    public Integer getMax() {
        return max;
    }

    @Override
    public RegexNodeType getType() {
        return RegexNodeType.REPETITION;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RepetitionNode)) {
            return false;
        }
        RepetitionNode other = (RepetitionNode) o;
        return node.equals(other.node) && Objects.equals(min, other.min) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(RegexNodeType.REPETITION, node, min, max);
    }

    @Override
    public String toString() {
        String base;
        switch (node.getType()) {
            case LITERAL:
            case RANGE:
            case WILDCARD:
                base = node.toString();
                break;
            default:
                base = "(" + node + ")";
        }
        if (min == null && max == null) {
            return base + "*";
        }
        if (min != null && min == 1 && max == null) {
            return base + "+";
        }
        if (min != null && min == 0 && max != null && max == 1) {
            return base + "?";
        }
        if (min != null && min.equals(max)) {
            return base + "{" + min + "}";
        }
        return base + "{" + (min == null ? "" : min) + "," + (max == null ? "" : max) + "}";
    }
}
