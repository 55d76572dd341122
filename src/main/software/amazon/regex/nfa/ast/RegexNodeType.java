package software.amazon.regex.nfa.ast;

/**
 * The node variants an AST source can produce.
 */
public enum RegexNodeType {
    LITERAL,        // one exact byte
    RANGE,          // inclusive byte range
    WILDCARD,       // any byte
    CONCATENATION,  // left followed by right
    ALTERNATION,    // left or right
    REPETITION      // {min,max} repeat of a sub-expression, either bound may be absent
}
