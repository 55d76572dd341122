package software.amazon.regex.nfa;

import javax.annotation.concurrent.Immutable;

/**
 * What a construction call hands back to its caller: the fragment it built and the allocator to continue with.
 */
@Immutable
final class Construction {
    final SubAutomaton fragment;
    final StateAllocator allocator;

    Construction(final SubAutomaton fragment, final StateAllocator allocator) {
        this.fragment = fragment;
        this.allocator = allocator;
    }

    int exit() {
        return fragment.exit;
    }
}
