package software.amazon.regex.nfa.ast;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static software.amazon.regex.nfa.ast.RegexNode.anyOf;
import static software.amazon.regex.nfa.ast.RegexNode.concat;
import static software.amazon.regex.nfa.ast.RegexNode.literal;
import static software.amazon.regex.nfa.ast.RegexNode.oneOrMore;
import static software.amazon.regex.nfa.ast.RegexNode.optional;
import static software.amazon.regex.nfa.ast.RegexNode.or;
import static software.amazon.regex.nfa.ast.RegexNode.range;
import static software.amazon.regex.nfa.ast.RegexNode.repeat;
import static software.amazon.regex.nfa.ast.RegexNode.sequence;
import static software.amazon.regex.nfa.ast.RegexNode.wildcard;
import static software.amazon.regex.nfa.ast.RegexNode.zeroOrMore;

public class RegexNodeTest {

    private static final RegexNode A = literal((byte) 'a');
    private static final RegexNode B = literal((byte) 'b');
    private static final RegexNode C = literal((byte) 'c');

    @Test
    public void testTypes() {
        assertEquals(RegexNodeType.LITERAL, A.getType());
        assertEquals(RegexNodeType.RANGE, range((byte) 'a', (byte) 'z').getType());
        assertEquals(RegexNodeType.WILDCARD, wildcard().getType());
        assertEquals(RegexNodeType.CONCATENATION, concat(A, B).getType());
        assertEquals(RegexNodeType.ALTERNATION, or(A, B).getType());
        assertEquals(RegexNodeType.REPETITION, zeroOrMore(A).getType());
    }

    @Test
    public void testShorthandRepetitions() {
        RepetitionNode star = zeroOrMore(A);
        assertNull(star.getMin());
        assertNull(star.getMax());

        RepetitionNode plus = oneOrMore(A);
        assertEquals(Integer.valueOf(1), plus.getMin());
        assertNull(plus.getMax());

        RepetitionNode question = optional(A);
        assertEquals(Integer.valueOf(0), question.getMin());
        assertEquals(Integer.valueOf(1), question.getMax());
        assertSame(A, question.getNode());
    }

    @Test
    public void testSequenceNestsToTheRight() {
        assertEquals(concat(A, concat(B, C)), sequence(Arrays.asList(A, B, C)));
        assertSame(A, sequence(Collections.singletonList(A)));
    }

    @Test
    public void testAnyOfNestsToTheRight() {
        assertEquals(or(A, or(B, C)), anyOf(Arrays.asList(A, B, C)));
        assertSame(A, anyOf(Collections.singletonList(A)));
    }

    @Test
    public void testFoldRejectsEmptyList() {
        try {
            sequence(Collections.<RegexNode>emptyList());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            anyOf(Collections.<RegexNode>emptyList());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testEqualsAndHashCode() {
        assertEquals(concat(A, or(B, C)), concat(literal((byte) 'a'), or(literal((byte) 'b'), literal((byte) 'c'))));
        assertEquals(concat(A, or(B, C)).hashCode(),
                concat(literal((byte) 'a'), or(literal((byte) 'b'), literal((byte) 'c'))).hashCode());
        assertNotEquals(concat(A, B), concat(B, A));
        assertNotEquals(concat(A, B), or(A, B));
        assertNotEquals(repeat(A, 1, 2), repeat(A, 1, 3));
        assertNotEquals(repeat(A, null, 2), repeat(A, 0, 2));
        assertSame(wildcard(), wildcard());
    }

    @Test
    public void testRangeValidityIsUnsigned() {
        assertTrue(range((byte) 'a', (byte) 'z').isValid());
        assertTrue(range((byte) 'a', (byte) 'a').isValid());
        assertFalse(range((byte) 'z', (byte) 'a').isValid());
        assertTrue(range((byte) 0x10, (byte) 0xF0).isValid());
        assertFalse(range((byte) 0xF0, (byte) 0x10).isValid());
    }

    @Test
    public void testToString() {
        assertEquals("a", A.toString());
        assertEquals("\\.", literal((byte) '.').toString());
        assertEquals("\\x0A", literal((byte) '\n').toString());
        assertEquals("\\xE9", literal((byte) 0xE9).toString());
        assertEquals("[a-z]", range((byte) 'a', (byte) 'z').toString());
        assertEquals(".", wildcard().toString());
        assertEquals("ab", concat(A, B).toString());
        assertEquals("a|b|c", or(A, or(B, C)).toString());
        assertEquals("(a|b)|c", or(or(A, B), C).toString());
        assertEquals("(a|b)c", concat(or(A, B), C).toString());
        assertEquals("a*", zeroOrMore(A).toString());
        assertEquals("a+", oneOrMore(A).toString());
        assertEquals("a?", optional(A).toString());
        assertEquals("a{3}", repeat(A, 3, 3).toString());
        assertEquals("a{2,}", repeat(A, 2, null).toString());
        assertEquals("a{,4}", repeat(A, null, 4).toString());
        assertEquals("a{,1}", repeat(A, null, 1).toString());
        assertEquals("a?", repeat(A, 0, 1).toString());
        assertEquals("(ab){2,3}", repeat(concat(A, B), 2, 3).toString());
    }

    @Test
    public void testToStringParsesBackToSameTree() {
        RegexNode[] trees = {
                concat(or(A, B), repeat(C, 2, 3)),
                or(repeat(wildcard(), 1, null), concat(range((byte) '0', (byte) '9'), optional(A))),
                concat(literal((byte) '('), concat(literal((byte) 0xFF), literal((byte) '{'))),
                repeat(repeat(A, 1, 2), null, 3),
                repeat(B, null, 1)
        };
        for (RegexNode tree : trees) {
            assertEquals(tree.toString(), tree, RegexParser.parse(tree.toString()));
        }
    }

    @Test
    public void testLongSequencesCompareAndRender() {
        List<RegexNode> first = new ArrayList<>();
        List<RegexNode> second = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 50000; i++) {
            first.add(literal((byte) 'a'));
            second.add(literal((byte) 'a'));
            text.append('a');
        }
        RegexNode sequence = sequence(first);
        assertEquals(sequence, sequence(second));
        assertEquals(sequence.hashCode(), sequence(second).hashCode());
        assertEquals(text.toString(), sequence.toString());

        second.set(49999, literal((byte) 'b'));
        assertNotEquals(sequence, sequence(second));
    }

    @Test
    public void testLongAlternativeListsCompareAndRender() {
        List<RegexNode> first = new ArrayList<>();
        List<RegexNode> second = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            first.add(literal((byte) 'a'));
            second.add(literal((byte) 'a'));
        }
        RegexNode alternatives = anyOf(first);
        assertEquals(alternatives, anyOf(second));
        assertEquals(alternatives.hashCode(), anyOf(second).hashCode());
        String rendered = alternatives.toString();
        assertEquals(2 * 20000 - 1, rendered.length());
        assertTrue(rendered.startsWith("a|a|"));
        assertNotEquals(alternatives, sequence(second));
    }
}
