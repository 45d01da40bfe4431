package org.eden.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** The literal {@code nil}. */
    NIL,
    /** The literal {@code true}. */
    TRUE,
    /** The literal {@code false}. */
    FALSE,
    /** A symbol, optionally namespaced with a single '/'. */
    SYMBOL,
    /** A keyword; the value holds the text after the leading ':'. */
    KEYWORD,
    /** A string literal with its escape sequences decoded. */
    STRING,
    /** A character literal such as {@code \a}. */
    CHARACTER,
    /** An integer literal, including an optional sign and 'N' suffix. */
    INTEGER,
    /** A floating-point literal, including an optional 'M' suffix. */
    FLOAT,

    // Miscellaneous.
    /** A line comment starting with ';'. */
    COMMENT,

    // Dispatch markers.
    /** The '#_' marker. */
    DISCARD,
    /** A tagged literal marker such as {@code #inst}. */
    TAG,
    /** The '#:' namespace-map marker. */
    NS_MAP,
    /** The '#{' marker that opens a set. */
    SET_OPEN,

    // Single-character delimiters.
    /** The '{' character. */
    CURLY_OPEN,
    /** The '}' character. */
    CURLY_CLOSE,
    /** The '[' character. */
    BRACKET_OPEN,
    /** The ']' character. */
    BRACKET_CLOSE,
    /** The '(' character. */
    PAREN_OPEN,
    /** The ')' character. */
    PAREN_CLOSE
}
