package software.amazon.regex.nfa;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Renders an NFA as a Graphviz digraph, one line per element: states in ascending order, input transitions and then
 * epsilon transitions in the order they were created, the final states and finally the start state. The output for a
 * given NFA is always exactly the same.
 */
@ThreadSafe
public final class DotSerializer {

    static final String HEADER = "digraph NFA {";
    static final String TRAILER = "}";
    static final String EPSILON_LABEL = "ε";

    private DotSerializer() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    public static String toDot(@Nonnull final Nfa nfa) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(nfa, sb);
        } catch (IOException e) {
            // StringBuilder doesn't throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Write the digraph to a stream as UTF-8. The stream is flushed but not closed.
     */
    public static void write(@Nonnull final Nfa nfa, @Nonnull final OutputStream out) throws IOException {
        final Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        write(nfa, writer);
        writer.flush();
    }

    public static void write(@Nonnull final Nfa nfa, @Nonnull final Appendable out) throws IOException {
        out.append(HEADER).append('\n');
        for (Integer state : nfa.getStates()) {
            out.append('\t').append(String.valueOf(state)).append(";\n");
        }
        for (Transition transition : nfa.getTransitions()) {
            edge(out, transition.getSource(), transition.getDestination(), transition.getInput().toString());
        }
        for (EpsilonTransition epsilon : nfa.getEpsilonTransitions()) {
            edge(out, epsilon.getSource(), epsilon.getDestination(), EPSILON_LABEL);
        }
        for (Integer state : nfa.getFinalStates()) {
            out.append('\t').append(String.valueOf(state)).append(" [shape=doublecircle];\n");
        }
        out.append('\t').append(String.valueOf(nfa.getStartState())).append(" [shape=box];\n");
        out.append(TRAILER).append('\n');
    }

    private static void edge(final Appendable out, final int source, final int destination, final String label)
            throws IOException {
        out.append('\t').append(String.valueOf(source)).append(" -> ").append(String.valueOf(destination))
                .append(" [label=\"").append(escape(label)).append("\"];\n");
    }

    static String escape(final String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
