package org.eden.lexer;

/**
 * Character predicates used by the {@link Lexer} to pick transitions.
 * All methods take Unicode code points.
 */
final class CharClass {

    private static final String SYMBOL_PUNCTUATION = "_?.*+!-$%&=<>#:|";

    private CharClass() {}

    static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isSymbolChar(int c) {
        return isLetter(c) || isDigit(c) || (c < 128 && SYMBOL_PUNCTUATION.indexOf(c) >= 0);
    }

    /**
     * Whitespace in the notation's sense, which includes the comma.
     */
    static boolean isWhitespace(int c) {
        switch (c) {
            case ' ', '\t', '\n', '\u000B', '\f', '\r', ',':
                return true;
            default:
                return false;
        }
    }

    static boolean isDelimiter(int c) {
        return delimiterType(c) != null;
    }

    static boolean isSeparator(int c) {
        return isWhitespace(c) || isDelimiter(c);
    }

    /**
     * @param c The code point to map.
     * @return The token type of a single-character delimiter, or {@code null} if {@code c} is none.
     */
    static TokenType delimiterType(int c) {
        switch (c) {
            case '{': return TokenType.CURLY_OPEN;
            case '}': return TokenType.CURLY_CLOSE;
            case '[': return TokenType.BRACKET_OPEN;
            case ']': return TokenType.BRACKET_CLOSE;
            case '(': return TokenType.PAREN_OPEN;
            case ')': return TokenType.PAREN_CLOSE;
            default: return null;
        }
    }
}
