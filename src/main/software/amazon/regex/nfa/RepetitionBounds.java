package software.amazon.regex.nfa;

import software.amazon.regex.nfa.ast.RepetitionNode;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The two phases a {min,max} repetition is built in: a mandatory number of occurrences, followed by an optional number
 * of further occurrences that may be unbounded.
 * <p>
 * Resolution rules, with absent bounds written as "-":
 * <ul>
 *     <li>{-,-} and {m,-}: m (or 0) mandatory, unbounded optional</li>
 *     <li>{m,n}: m mandatory, n - m optional</li>
 *     <li>{-,n}: 0 mandatory, n optional, unless strict bounds are requested, in which case it is rejected</li>
 * </ul>
 */
@Immutable
final class RepetitionBounds {

    final int mandatory;

    /**
     * The number of optional occurrences, or null if there is no limit.
     */
    @Nullable
    final Integer optional;

    private RepetitionBounds(final int mandatory, @Nullable final Integer optional) {
        this.mandatory = mandatory;
        this.optional = optional;
    }

    boolean isUnbounded() {
        return optional == null;
    }

    static RepetitionBounds resolve(final RepetitionNode node, final boolean strictBounds) {
        final Integer min = node.getMin();
        final Integer max = node.getMax();
        if (min != null && min < 0) {
            throw new InvalidRepetitionBoundException("Repetition minimum must not be negative: " + node);
        }
        if (max != null && max < 0) {
            throw new InvalidRepetitionBoundException("Repetition maximum must not be negative: " + node);
        }
        if (max == null) {
            return new RepetitionBounds(min == null ? 0 : min, null);
        }
        if (min == null) {
            if (strictBounds) {
                throw new UnsupportedBoundCombinationException(
                        "Repetition has a maximum but no minimum: " + node);
            }
            return new RepetitionBounds(0, max);
        }
        if (max < min) {
            throw new InvalidRepetitionBoundException("Repetition maximum is less than its minimum: " + node);
        }
        return new RepetitionBounds(min, max - min);
    }

    @Override
    public String toString() {
        return "RepetitionBounds{mandatory=" + mandatory + ", optional=" + (optional == null ? "unbounded" : optional) +
                '}';
    }
}
