package org.eden.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds the token currently being scanned and collects finished tokens in source order.
 * Finishing is the only way a token reaches the output.
 */
final class TokenBuilder {

    private final LocationTracker cursor;
    private final boolean captureLocation;
    private final List<Token> tokens = new ArrayList<>();

    private TokenType type;
    private final StringBuilder value = new StringBuilder();
    private SourceLocation location;

    /**
     * @param cursor The cursor whose position is recorded when a token begins.
     * @param captureLocation Whether finished tokens carry their start location.
     */
    TokenBuilder(LocationTracker cursor, boolean captureLocation) {
        this.cursor = cursor;
        this.captureLocation = captureLocation;
    }

    /**
     * Starts a new token. Must be called before the token's first character is
     * passed to the cursor.
     */
    void begin(TokenType type, String initialValue) {
        this.type = type;
        this.value.setLength(0);
        this.value.append(initialValue);
        this.location = captureLocation ? cursor.position() : null;
    }

    void append(String text) {
        value.append(text);
    }

    void append(int codePoint) {
        value.appendCodePoint(codePoint);
    }

    /**
     * Changes the type of the current token, keeping its value and start location.
     */
    void retype(TokenType newType) {
        this.type = newType;
    }

    boolean isActive() {
        return type != null;
    }

    boolean valueContains(char c) {
        return value.indexOf(String.valueOf(c)) >= 0;
    }

    /**
     * @return A snapshot of the token under construction, or {@code null} if there is none.
     */
    Token current() {
        return isActive() ? new Token(type, value.toString(), location) : null;
    }

    /**
     * Moves the current token to the output and clears it.
     * @throws UnfinishedTokenException if the current token is a keyword without a name.
     */
    void finish() {
        Token token = current();
        if (token.type() == TokenType.KEYWORD && token.value().isEmpty()) {
            throw new UnfinishedTokenException(token);
        }
        tokens.add(token);
        type = null;
        value.setLength(0);
        location = null;
    }

    List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }
}
