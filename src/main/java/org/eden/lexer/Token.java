package org.eden.lexer;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Symbol, Integer, String).
 * @param value The text of the token as scanned. Strings carry their decoded content,
 *              numbers keep sign and suffix verbatim.
 * @param location The position of the token's first character, or {@code null} when
 *                 location tracking was not requested.
 */
public record Token(
        TokenType type,
        String value,
        SourceLocation location
) {

    /**
     * Creates a token without location information.
     * @param type The type of the token.
     * @param value The text of the token.
     */
    public Token(TokenType type, String value) {
        this(type, value, null);
    }

    /**
     * @return true if this token carries its start position.
     */
    public boolean hasLocation() {
        return location != null;
    }
}
