package software.amazon.regex.nfa.ast;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a syntax tree from its JSON form. Each node is an object with exactly one node key:
 * <pre>
 *   { "literal": 97 }
 *   { "range": [ 97, 122 ] }
 *   { "wildcard": true }
 *   { "concat": [ node, node, ... ] }
 *   { "or": [ node, node, ... ] }
 *   { "repeat": node, "min": 2, "max": 3 }
 * </pre>
 * Bytes are integers from 0 to 255. "concat" and "or" take one or more nodes and nest them to the right. The "min" and
 * "max" keys are only allowed next to "repeat"; either may be omitted or null to leave the bound absent.
 * <p>
 * Like RegexParser, this only checks the form of the tree. Bounds and ranges are checked by the NFA compiler.
 */
public final class JsonAstCompiler {

    static final String LITERAL = "literal";
    static final String RANGE = "range";
    static final String WILDCARD = "wildcard";
    static final String CONCAT = "concat";
    static final String OR = "or";
    static final String REPEAT = "repeat";
    static final String MIN = "min";
    static final String MAX = "max";

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private JsonAstCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Verify the form of a JSON syntax tree.
     *
     * @param source tree, as a String
     * @return null if the tree is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a syntax tree from its JSON form.
     *
     * @param source tree, as a String
     * @return the root node
     * @throws IOException if the tree isn't syntactically valid
     */
    public static RegexNode compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static RegexNode compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static RegexNode compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static RegexNode compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static RegexNode doCompile(final JsonParser parser) throws IOException {
        try {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Syntax tree is not an object");
            }
            final RegexNode root = parseNode(parser);
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after syntax tree");
            }
            return root;
        } finally {
            parser.close();
        }
    }

    // on entry the current token is the START_OBJECT of the node, on exit its END_OBJECT
    private static RegexNode parseNode(final JsonParser parser) throws IOException {
        String kind = null;
        RegexNode node = null;
        Integer min = null;
        Integer max = null;
        boolean boundsPresent = false;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            final JsonToken valueToken = parser.nextToken();

            if (MIN.equals(fieldName) || MAX.equals(fieldName)) {
                boundsPresent = true;
                final Integer bound = parseBound(parser, fieldName, valueToken);
                if (MIN.equals(fieldName)) {
                    min = bound;
                } else {
                    max = bound;
                }
                continue;
            }

            if (kind != null) {
                barf(parser, String.format("Node already has kind \"%s\", found \"%s\"", kind, fieldName));
            }
            kind = fieldName;

            switch (fieldName) {
            case LITERAL:
                node = RegexNode.literal(parseByte(parser, valueToken, "literal value"));
                break;

            case RANGE:
                if (valueToken != JsonToken.START_ARRAY) {
                    barf(parser, "range must be an array of two bytes");
                }
                final byte bottom = parseByte(parser, parser.nextToken(), "range minimum");
                final byte top = parseByte(parser, parser.nextToken(), "range maximum");
                if (parser.nextToken() != JsonToken.END_ARRAY) {
                    barf(parser, "range must be an array of two bytes");
                }
                node = RegexNode.range(bottom, top);
                break;

            case WILDCARD:
                if (valueToken != JsonToken.VALUE_TRUE) {
                    barf(parser, "wildcard value must be true");
                }
                node = RegexNode.wildcard();
                break;

            case CONCAT:
                node = RegexNode.sequence(parseNodeList(parser, valueToken, CONCAT));
                break;

            case OR:
                node = RegexNode.anyOf(parseNodeList(parser, valueToken, OR));
                break;

            case REPEAT:
                if (valueToken != JsonToken.START_OBJECT) {
                    barf(parser, "repeat value must be a node");
                }
                node = parseNode(parser);
                break;

            default:
                barf(parser, String.format("Unrecognized node kind \"%s\"", fieldName));
            }
        }

        if (kind == null) {
            barf(parser, "Node must have a kind");
        }
        if (REPEAT.equals(kind)) {
            return RegexNode.repeat(node, min, max);
        }
        if (boundsPresent) {
            barf(parser, String.format("\"%s\" and \"%s\" are only allowed on a %s node", MIN, MAX, REPEAT));
        }
        return node;
    }

    private static List<RegexNode> parseNodeList(final JsonParser parser, final JsonToken valueToken,
                                                 final String kind) throws IOException {
        if (valueToken != JsonToken.START_ARRAY) {
            barf(parser, String.format("%s value must be an array of nodes", kind));
        }
        final List<RegexNode> nodes = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.START_OBJECT) {
                barf(parser, String.format("%s value must be an array of nodes", kind));
            }
            nodes.add(parseNode(parser));
        }
        if (nodes.isEmpty()) {
            barf(parser, "Empty arrays are not allowed");
        }
        return nodes;
    }

    private static byte parseByte(final JsonParser parser, final JsonToken token, final String what)
            throws IOException {
        if (token != JsonToken.VALUE_NUMBER_INT) {
            barf(parser, String.format("%s must be an integer from 0 to 255", what));
        }
        final long value = parser.getLongValue();
        if (value < 0 || value > 255) {
            barf(parser, String.format("%s must be an integer from 0 to 255", what));
        }
        return (byte) value;
    }

    private static Integer parseBound(final JsonParser parser, final String fieldName, final JsonToken token)
            throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.VALUE_NUMBER_INT) {
            barf(parser, String.format("\"%s\" must be an integer or null", fieldName));
        }
        return parser.getIntValue();
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
