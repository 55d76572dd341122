package software.amazon.regex.nfa.ast;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses regular expression text into a RegexNode tree. The expression is read as UTF-8 bytes, so a character outside
 * ASCII becomes the concatenation of its encoded bytes.
 * <p>
 * Supported syntax: alternation {@code a|b}, grouping {@code (ab)}, the wildcard {@code .}, character classes such as
 * {@code [a-z]} or {@code [a-cx_]}, the quantifiers {@code * + ?} and {@code {n} {n,} {n,m} {,m}}, and the escapes
 * {@code \n \r \t \xHH} as well as a backslash in front of any metacharacter. Concatenation and alternation nest to
 * the right.
 * <p>
 * Only syntax is checked here. Inverted ranges such as {@code [z-a]} and inverted bounds such as {@code {3,2}} parse
 * into nodes that the NFA compiler rejects.
 */
public final class RegexParser {

    static final byte BACKSLASH_BYTE = 0x5C;
    static final byte LEFT_PARENTHESIS_BYTE = 0x28;
    static final byte RIGHT_PARENTHESIS_BYTE = 0x29;
    static final byte ASTERISK_BYTE = 0x2A;
    static final byte PLUS_SIGN_BYTE = 0x2B;
    static final byte COMMA_BYTE = 0x2C;
    static final byte HYPHEN_BYTE = 0x2D;
    static final byte PERIOD_BYTE = 0x2E;
    static final byte QUESTION_MARK_BYTE = 0x3F;
    static final byte LEFT_SQUARE_BRACKET_BYTE = 0x5B;
    static final byte RIGHT_SQUARE_BRACKET_BYTE = 0x5D;
    static final byte CARET_BYTE = 0x5E;
    static final byte LEFT_CURLY_BRACKET_BYTE = 0x7B;
    static final byte PIPE_BYTE = 0x7C;
    static final byte RIGHT_CURLY_BRACKET_BYTE = 0x7D;

    private static final String META_CHARACTERS = "\\|()[]{}*+?.";
    private static final String ESCAPABLE_CHARACTERS = META_CHARACTERS + "-^$";

    private final byte[] bytes;
    private int pos = 0;

    private RegexParser(final String regex) {
        this.bytes = regex.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse a regular expression.
     *
     * @param regex The expression text.
     * @return The root of the syntax tree.
     * @throws ParseException if the expression is empty or not well-formed.
     */
    public static RegexNode parse(final String regex) {
        final RegexParser parser = new RegexParser(regex);
        if (parser.bytes.length == 0) {
            throw new ParseException("Empty regular expression");
        }
        final RegexNode root = parser.parseAlternation();
        if (parser.pos < parser.bytes.length) {
            // the only way to stop early is an unmatched closing parenthesis
            throw new ParseException("Unbalanced parenthesis at pos " + parser.pos);
        }
        return root;
    }

    /**
     * Verify the syntax of a regular expression.
     *
     * @param regex The expression text.
     * @return null if the expression is valid, otherwise an error message.
     */
    public static String check(final String regex) {
        try {
            parse(regex);
            return null;
        } catch (ParseException e) {
            return e.getLocalizedMessage();
        }
    }

    static boolean isMetaCharacter(final int value) {
        return META_CHARACTERS.indexOf(value) >= 0;
    }

    private RegexNode parseAlternation() {
        final List<RegexNode> alternatives = new ArrayList<>();
        alternatives.add(parseConcatenation());
        while (pos < bytes.length && bytes[pos] == PIPE_BYTE) {
            pos++;
            alternatives.add(parseConcatenation());
        }
        return RegexNode.anyOf(alternatives);
    }

    private RegexNode parseConcatenation() {
        final int start = pos;
        final List<RegexNode> sequence = new ArrayList<>();
        while (pos < bytes.length && bytes[pos] != PIPE_BYTE && bytes[pos] != RIGHT_PARENTHESIS_BYTE) {
            sequence.add(parseRepetition());
        }
        if (sequence.isEmpty()) {
            throw new ParseException("Empty expression at pos " + start);
        }
        return RegexNode.sequence(sequence);
    }

    private RegexNode parseRepetition() {
        RegexNode node = parseAtom();
        while (pos < bytes.length) {
            final byte b = bytes[pos];
            if (b == ASTERISK_BYTE) {
                node = RegexNode.zeroOrMore(node);
                pos++;
            } else if (b == PLUS_SIGN_BYTE) {
                node = RegexNode.oneOrMore(node);
                pos++;
            } else if (b == QUESTION_MARK_BYTE) {
                node = RegexNode.optional(node);
                pos++;
            } else if (b == LEFT_CURLY_BRACKET_BYTE) {
                node = parseBounds(node);
            } else {
                break;
            }
        }
        return node;
    }

    private RegexNode parseBounds(final RegexNode node) {
        final int start = pos;
        pos++;
        final Integer min = parseNumber();
        Integer max = min;
        if (pos < bytes.length && bytes[pos] == COMMA_BYTE) {
            pos++;
            max = parseNumber();
            if (min == null && max == null) {
                throw new ParseException("Repetition without any bound at pos " + start);
            }
        } else if (min == null) {
            throw new ParseException("Invalid repetition at pos " + start);
        }
        if (pos >= bytes.length || bytes[pos] != RIGHT_CURLY_BRACKET_BYTE) {
            throw new ParseException("Unterminated repetition at pos " + start);
        }
        pos++;
        return RegexNode.repeat(node, min, max);
    }

    private Integer parseNumber() {
        final int start = pos;
        long value = 0;
        while (pos < bytes.length && bytes[pos] >= '0' && bytes[pos] <= '9') {
            value = value * 10 + (bytes[pos] - '0');
            if (value > Integer.MAX_VALUE) {
                throw new ParseException("Repetition bound too large at pos " + start);
            }
            pos++;
        }
        return pos == start ? null : (int) value;
    }

    private RegexNode parseAtom() {
        final int start = pos;
        final byte b = bytes[pos];
        switch (b) {
            case LEFT_PARENTHESIS_BYTE: {
                pos++;
                final RegexNode group = parseAlternation();
                if (pos >= bytes.length || bytes[pos] != RIGHT_PARENTHESIS_BYTE) {
                    throw new ParseException("Unbalanced parenthesis at pos " + start);
                }
                pos++;
                return group;
            }
            case PERIOD_BYTE:
                pos++;
                return RegexNode.wildcard();
            case LEFT_SQUARE_BRACKET_BYTE:
                return parseClass();
            case BACKSLASH_BYTE:
                return RegexNode.literal(parseEscape());
            case ASTERISK_BYTE:
            case PLUS_SIGN_BYTE:
            case QUESTION_MARK_BYTE:
            case LEFT_CURLY_BRACKET_BYTE:
                throw new ParseException("Quantifier without a preceding expression at pos " + start);
            case RIGHT_SQUARE_BRACKET_BYTE:
            case RIGHT_CURLY_BRACKET_BYTE:
                throw new ParseException("Unbalanced bracket at pos " + start);
            default:
                return parseCharacter();
        }
    }

    private RegexNode parseCharacter() {
        final int length = utf8Length(bytes[pos]);
        if (pos + length > bytes.length) {
            throw new ParseException("Truncated character at pos " + pos);
        }
        final List<RegexNode> sequence = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            sequence.add(RegexNode.literal(bytes[pos++]));
        }
        return RegexNode.sequence(sequence);
    }

    private RegexNode parseClass() {
        final int start = pos;
        pos++;
        if (pos < bytes.length && bytes[pos] == CARET_BYTE) {
            throw new ParseException("Negated character classes are not supported at pos " + start);
        }
        final List<RegexNode> items = new ArrayList<>();
        while (pos < bytes.length && bytes[pos] != RIGHT_SQUARE_BRACKET_BYTE) {
            final byte min = parseClassByte();
            if (pos + 1 < bytes.length && bytes[pos] == HYPHEN_BYTE && bytes[pos + 1] != RIGHT_SQUARE_BRACKET_BYTE) {
                pos++;
                final byte max = parseClassByte();
                items.add(RegexNode.range(min, max));
            } else {
                items.add(RegexNode.literal(min));
            }
        }
        if (pos >= bytes.length) {
            throw new ParseException("Unterminated character class at pos " + start);
        }
        pos++;
        if (items.isEmpty()) {
            throw new ParseException("Empty character class at pos " + start);
        }
        return RegexNode.anyOf(items);
    }

    private byte parseClassByte() {
        final byte b = bytes[pos];
        if (b == BACKSLASH_BYTE) {
            return parseEscape();
        }
        if (utf8Length(b) != 1) {
            throw new ParseException("Only single-byte characters are allowed in a character class at pos " + pos);
        }
        pos++;
        return b;
    }

    private byte parseEscape() {
        final int start = pos;
        pos++;
        if (pos >= bytes.length) {
            throw new ParseException("Invalid escape character at pos " + start);
        }
        final byte b = bytes[pos++];
        switch (b) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'x':
                if (pos + 2 > bytes.length) {
                    throw new ParseException("Invalid hex escape at pos " + start);
                }
                final int high = Character.digit(bytes[pos], 16);
                final int low = Character.digit(bytes[pos + 1], 16);
                if (high < 0 || low < 0) {
                    throw new ParseException("Invalid hex escape at pos " + start);
                }
                pos += 2;
                return (byte) (high * 16 + low);
            default:
                if (ESCAPABLE_CHARACTERS.indexOf(b) < 0) {
                    throw new ParseException("Invalid escape character at pos " + start);
                }
                return b;
        }
    }

    private static int utf8Length(final byte lead) {
        final int value = Byte.toUnsignedInt(lead);
        if (value < 0x80) {
            return 1;
        } else if (value >= 0xF0) {
            return 4;
        } else if (value >= 0xE0) {
            return 3;
        } else if (value >= 0xC0) {
            return 2;
        }
        throw new ParseException("Malformed UTF-8 sequence");
    }
}
