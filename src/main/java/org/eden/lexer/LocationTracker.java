package org.eden.lexer;

/**
 * Keeps the line/column cursor of a scan up to date as text is consumed.
 * Lines are 1-based, columns 0-based. A carriage return does not move the cursor.
 */
final class LocationTracker {

    private int line = 1;
    private int col = 0;

    /**
     * Advances the cursor over the given raw source text, left to right.
     * @param consumed The exact text taken from the input.
     */
    void advance(String consumed) {
        consumed.codePoints().forEach(this::advance);
    }

    void advance(int codePoint) {
        if (codePoint == '\n') {
            line++;
            col = 0;
        } else if (codePoint != '\r') {
            col++;
        }
    }

    SourceLocation position() {
        return new SourceLocation(line, col);
    }
}
