package org.eden.lexer;

import com.typesafe.config.Config;

/**
 * Options of a {@link Lexer} scan.
 *
 * @param location Whether every token carries the position of its first character.
 */
public record LexerOptions(boolean location) {

    /** Configuration path of the location flag. */
    public static final String LOCATION_PATH = "eden.lexer.location";

    /** No location tracking. */
    public static final LexerOptions DEFAULT = new LexerOptions(false);

    /**
     * @return Options identical to these but with location tracking turned on.
     */
    public LexerOptions withLocation() {
        return new LexerOptions(true);
    }

    /**
     * Reads the options from the {@code eden.lexer} section of the given configuration.
     * Missing settings fall back to {@link #DEFAULT}.
     *
     * @param config The resolved application configuration.
     * @return The options described by the configuration.
     */
    public static LexerOptions fromConfig(Config config) {
        if (!config.hasPath(LOCATION_PATH)) {
            return DEFAULT;
        }
        return new LexerOptions(config.getBoolean(LOCATION_PATH));
    }
}
