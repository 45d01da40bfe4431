package org.eden.lexer;

/**
 * A position in the source text.
 *
 * @param line The 1-based line number.
 * @param col The 0-based column.
 */
public record SourceLocation(int line, int col) {

    @Override
    public String toString() {
        return line + ":" + col;
    }
}
