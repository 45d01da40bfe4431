package org.eden.lexer;

/**
 * Thrown when no transition of the current scan state accepts the next character.
 */
public class UnexpectedInputException extends LexerException {

    private final String input;
    private final SourceLocation location;

    /**
     * @param input The offending character.
     * @param location The cursor position of the offending character.
     */
    public UnexpectedInputException(String input, SourceLocation location) {
        super(String.format("Unexpected input '%s' at %s", input, location));
        this.input = input;
        this.location = location;
    }

    /**
     * @return The offending character as a string (a full code point).
     */
    public String input() {
        return input;
    }

    /**
     * @return Where the offending character was found. Always present, independent of
     *         whether token locations were requested.
     */
    public SourceLocation location() {
        return location;
    }
}
