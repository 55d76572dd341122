package software.amazon.regex.nfa.ast;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.List;

/**
 * A node of a regular expression syntax tree. Trees are immutable and are only ever read by the NFA construction,
 * which never re-validates them beyond what the AstValidator does before construction begins.
 * <p>
 * The static methods here are the supported way for application code to build trees; RegexParser and
 * JsonAstCompiler use them too.
 */
@Immutable
public abstract class RegexNode {

    RegexNode() { }

    public abstract RegexNodeType getType();

    /**
     * Render this node back to regex syntax. Not guaranteed to be the text that was originally parsed, but parsing it
     * yields a tree matching the same language.
     */
    @Override
    public abstract String toString();

    public static LiteralNode literal(final byte b) {
        return new LiteralNode(b);
    }

    public static RangeNode range(final byte min, final byte max) {
        return new RangeNode(min, max);
    }

    public static WildcardNode wildcard() {
        return WildcardNode.INSTANCE;
    }

    public static ConcatenationNode concat(@Nonnull final RegexNode left, @Nonnull final RegexNode right) {
        return new ConcatenationNode(left, right);
    }

    public static AlternationNode or(@Nonnull final RegexNode left, @Nonnull final RegexNode right) {
        return new AlternationNode(left, right);
    }

    /**
     * Create a {min,max} repetition. A null bound is absent: an absent max means unbounded.
     */
    public static RepetitionNode repeat(@Nonnull final RegexNode node, @Nullable final Integer min,
                                        @Nullable final Integer max) {
        return new RepetitionNode(node, min, max);
    }

    public static RepetitionNode zeroOrMore(@Nonnull final RegexNode node) {
        return repeat(node, null, null);
    }

    public static RepetitionNode oneOrMore(@Nonnull final RegexNode node) {
        return repeat(node, 1, null);
    }

    /**
     * Create a {0,1} repetition. The minimum is present, so strict bounds accept it.
     */
    public static RepetitionNode optional(@Nonnull final RegexNode node) {
        return repeat(node, 0, 1);
    }

    /**
     * Concatenate a non-empty sequence of nodes, nesting to the right: [a, b, c] becomes concat(a, concat(b, c)).
     */
    public static RegexNode sequence(@Nonnull final List<RegexNode> nodes) {
        return fold(nodes, true);
    }

    /**
     * Alternate a non-empty list of nodes, nesting to the right: [a, b, c] becomes or(a, or(b, c)).
     */
    public static RegexNode anyOf(@Nonnull final List<RegexNode> nodes) {
        return fold(nodes, false);
    }

    private static RegexNode fold(final List<RegexNode> nodes, final boolean concatenate) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Must provide at least one node");
        }
        RegexNode result = nodes.get(nodes.size() - 1);
        for (int i = nodes.size() - 2; i >= 0; i--) {
            result = concatenate ? concat(nodes.get(i), result) : or(nodes.get(i), result);
        }
        return result;
    }

    /**
     * Escape a byte for regex syntax, used by the toString() implementations.
     */
    static String byteToRegex(final byte b) {
        int value = Byte.toUnsignedInt(b);
        if (value < 0x20 || value >= 0x7F) {
            return String.format("\\x%02X", value);
        }
        if (RegexParser.isMetaCharacter(value)) {
            return "\\" + (char) value;
        }
        return String.valueOf((char) value);
    }
}
