package org.eden.lexer;

/**
 * States of the {@link Lexer}'s scanning loop.
 * Every state except {@link #NEW} has a token under construction.
 */
enum ScanState {
    NEW,
    COMMENT,
    /** A nil/true/false prefix was read; the next character decides if it stays a literal. */
    CHECK_LITERAL,
    STRING,
    /** A '\' was read and the character it introduces is still missing. */
    CHARACTER,
    SYMBOL,
    NUMBER,
    /** A '.' was read and no digit followed yet. */
    FRACTION,
    /** An 'e' or 'E' was read and no digit followed yet. */
    EXPONENT
}
