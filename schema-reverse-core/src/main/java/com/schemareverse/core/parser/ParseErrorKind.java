package com.schemareverse.core.parser;

/**
 * Reasons a construct parser can give up on its input.
 *
 * @since 1.0.0
 */
public enum ParseErrorKind {
    /** Null or blank text. */
    INVALID_INPUT,
    /** A parenthesized section has no matching close. */
    UNBALANCED_PARENTHESES,
    /** A block (IF, LOOP) reaches the end of the text without its END keyword. */
    UNTERMINATED_BLOCK,
    /** The construct keyword is present but its required shape is not. */
    MALFORMED_CONSTRUCT,
    /** Nested constructs exceed the parser's depth limit. */
    NESTING_TOO_DEEP,
    /** Unexpected failure inside the parser. */
    INTERNAL_ERROR
}
