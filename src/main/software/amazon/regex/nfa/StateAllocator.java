package software.amazon.regex.nfa;

import javax.annotation.concurrent.Immutable;

/**
 * Hands out state identifiers. An allocator is a value: allocating returns the new identifier together with the
 * allocator to use for everything built afterwards, so each construction call receives the allocator from its caller
 * and passes the updated one back. Identifiers from one chain of allocators are strictly increasing.
 */
@Immutable
final class StateAllocator {

    private final int next;

    private StateAllocator(final int next) {
        this.next = next;
    }

    /**
     * The allocator for a fresh construction, whose first identifier is the start state 0.
     */
    static StateAllocator initial() {
        return new StateAllocator(0);
    }

    static StateAllocator startingAt(final int next) {
        if (next < 0) {
            throw new IllegalArgumentException("State identifiers are non-negative: " + next);
        }
        return new StateAllocator(next);
    }

    /**
     * The identifier the next allocation will return.
     */
    int peek() {
        return next;
    }

    Allocation allocate() {
        if (next == Integer.MAX_VALUE) {
            throw new IllegalStateException("State identifiers exhausted");
        }
        return new Allocation(next, new StateAllocator(next + 1));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StateAllocator && ((StateAllocator) o).next == next;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(next);
    }

    @Override
    public String toString() {
        return "StateAllocator{next=" + next + '}';
    }

    /**
     * A newly allocated state and the allocator to continue with.
     */
    @Immutable
    static final class Allocation {
        final int state;
        final StateAllocator allocator;

        private Allocation(final int state, final StateAllocator allocator) {
            this.state = state;
            this.allocator = allocator;
        }
    }
}
