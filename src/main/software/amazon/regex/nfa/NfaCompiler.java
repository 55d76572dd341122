package software.amazon.regex.nfa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.regex.nfa.ast.JsonAstCompiler;
import software.amazon.regex.nfa.ast.RegexNode;
import software.amazon.regex.nfa.ast.RegexParser;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.util.Objects;

/**
 * Compiles regular expression syntax trees into NFAs.
 * <p>
 * Each compilation is a single depth-first pass over the tree that threads a StateAllocator through every construction
 * call, so the same tree always produces the same automaton with states numbered 0, 1, 2, ... in the order they were
 * created, and the start state is always 0. The tree is validated in full before the pass begins; a tree that can't be
 * compiled fails with an NfaConstructionException and nothing is built.
 * <p>
 * A compiler holds only its configuration. Every call builds into its own accumulator, so one compiler can be used from
 * many threads at once.
 */
@ThreadSafe
public class NfaCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(NfaCompiler.class);

    private final Configuration configuration;
    private final AstValidator validator;
    private final ThompsonBuilder builder;

    public NfaCompiler() {
        this(new Configuration.Builder().build());
    }

    public NfaCompiler(@Nonnull final Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.validator = new AstValidator(configuration);
        this.builder = new ThompsonBuilder(configuration.isStrictBounds());
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Compile a syntax tree.
     *
     * @param root the root of the tree
     * @return the automaton
     * @throws NfaConstructionException if the tree has an invalid range or repetition, or is too large
     */
    public Nfa compile(@Nonnull final RegexNode root) {
        Objects.requireNonNull(root, "root");
        final int expectedStates;
        try {
            expectedStates = validator.validate(root);
        } catch (NfaConstructionException e) {
            LOGGER.debug("Rejected syntax tree: {}", e.getMessage());
            throw e;
        }

        final NfaAccumulator accumulator = new NfaAccumulator();
        final StateAllocator.Allocation start = StateAllocator.initial().allocate();
        accumulator.addState(start.state);

        final Construction construction = builder.build(root, accumulator, start.state, start.allocator);
        final Nfa nfa = accumulator.toNfa(start.state, construction.exit());

        // the validator's count and the builder's allocation are two views of the same layout
        assert accumulator.stateCount() == expectedStates : "Expected " + expectedStates + " states, built " +
                accumulator.stateCount();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Compiled {} syntax tree into {} states, {} transitions and {} epsilon transitions",
                    root.getType(), accumulator.stateCount(), accumulator.transitionCount(),
                    accumulator.epsilonTransitionCount());
        }
        return nfa;
    }

    /**
     * Parse and compile a regular expression.
     *
     * @param regex the expression text, see RegexParser for the supported syntax
     * @return the automaton
     * @throws software.amazon.regex.nfa.ast.ParseException if the expression is not well-formed
     * @throws NfaConstructionException if the expression has an invalid range or repetition, or is too large
     */
    public Nfa compile(@Nonnull final String regex) {
        return compile(RegexParser.parse(regex));
    }

    /**
     * Compile a syntax tree given in JSON form.
     *
     * @param json the tree, see JsonAstCompiler for the format
     * @return the automaton
     * @throws IOException if the JSON isn't a syntactically valid tree
     * @throws NfaConstructionException if the tree has an invalid range or repetition, or is too large
     */
    public Nfa compileJson(@Nonnull final String json) throws IOException {
        return compile(JsonAstCompiler.compile(json));
    }
}
