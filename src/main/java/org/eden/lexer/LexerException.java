package org.eden.lexer;

/**
 * Base class for errors that abort a {@link Lexer} scan.
 * A scan that throws never returns a partial token list.
 */
public abstract class LexerException extends RuntimeException {

    /**
     * Constructs a new lexer exception with the specified detail message.
     * @param message The detail message.
     */
    protected LexerException(String message) {
        super(message);
    }
}
