package org.eden.lexer;

/**
 * Thrown when a token's grammar is not complete: the input ended inside a string,
 * a number stopped right after '.', 'e' or an exponent sign, a '\' ended the input,
 * or a keyword had no name.
 */
public class UnfinishedTokenException extends LexerException {

    private final Token token;

    /**
     * @param token The partial token as accumulated so far.
     */
    public UnfinishedTokenException(Token token) {
        super(String.format("Unfinished token %s \"%s\"%s", token.type(), token.value(),
                token.hasLocation() ? " starting at " + token.location() : ""));
        this.token = token;
    }

    /**
     * @return The partial token (type, accumulated value and, if tracked, start location).
     */
    public Token token() {
        return token;
    }
}
