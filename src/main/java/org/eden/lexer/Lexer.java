package org.eden.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters in the EDN-like data notation into a sequence of tokens.
 * <p>
 * The scan is a single left-to-right pass over the source with one code point of
 * lookahead. Whitespace and commas are skipped, everything else ends up in a token or
 * aborts the scan with a {@link LexerException}.
 * <p>
 * A Lexer instance is not thread-safe, but {@link #scanTokens()} may be called
 * repeatedly; every call is an independent scan.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final LexerOptions options;

    private LocationTracker cursor;
    private TokenBuilder builder;
    private ScanState state;
    private int current;

    /**
     * Creates a new Lexer without location tracking.
     * @param source The source text as a single string.
     */
    public Lexer(String source) {
        this(source, LexerOptions.DEFAULT);
    }

    /**
     * Creates a new Lexer.
     * @param source The source text as a single string.
     * @param options The scan options.
     */
    public Lexer(String source, LexerOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Tokenizes the given source without location tracking.
     * @param source The source text.
     * @return The tokens in source order.
     * @throws LexerException if the source is malformed.
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Tokenizes the given source.
     * @param source The source text.
     * @param options The scan options.
     * @return The tokens in source order.
     * @throws LexerException if the source is malformed.
     */
    public static List<Token> tokenize(String source, LexerOptions options) {
        return new Lexer(source, options).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source.
     * @return An unmodifiable list of the recognized tokens, in source order.
     * @throws UnexpectedInputException if a character fits no rule of the current state.
     * @throws UnfinishedTokenException if the source ends (or a number stops) before a token is complete.
     */
    public List<Token> scanTokens() {
        cursor = new LocationTracker();
        builder = new TokenBuilder(cursor, options.location());
        state = ScanState.NEW;
        current = 0;

        try {
            while (!isAtEnd()) {
                scanStep(peek());
            }
            finishInput();
        } catch (LexerException e) {
            LOG.debug("Tokenization aborted at offset {} of {}: {}", current, source.length(), e.getMessage());
            throw e;
        }

        List<Token> tokens = builder.tokens();
        LOG.debug("Tokenized {} chars into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private void scanStep(int c) {
        switch (state) {
            case NEW -> scanNew(c);
            case COMMENT -> scanComment(c);
            case CHECK_LITERAL -> checkLiteral(c);
            case STRING -> scanString(c);
            case CHARACTER -> {
                consume(text(c));
                finishToken();
            }
            case SYMBOL -> scanSymbol(c);
            case NUMBER -> scanNumber(c);
            case FRACTION, EXPONENT -> scanNumberPart(c);
        }
    }

    private void scanNew(int c) {
        TokenType literal = literalAt();
        if (literal != null) {
            String text = literalText(literal);
            start(literal, text, ScanState.CHECK_LITERAL);
            advance(text);
            return;
        }

        switch (c) {
            case ';' -> {
                start(TokenType.COMMENT, "", ScanState.COMMENT);
                advance(";");
            }
            case '"' -> {
                start(TokenType.STRING, "", ScanState.STRING);
                advance("\"");
            }
            case '\\' -> {
                start(TokenType.CHARACTER, "", ScanState.CHARACTER);
                advance("\\");
            }
            case ':' -> {
                start(TokenType.KEYWORD, "", ScanState.SYMBOL);
                advance(":");
            }
            case '#' -> scanDispatch();
            case '-', '+' -> {
                // The sign belongs to the number's text.
                String sign = text(c);
                start(TokenType.INTEGER, sign, ScanState.NUMBER);
                advance(sign);
            }
            default -> {
                String text = text(c);
                TokenType delimiter = CharClass.delimiterType(c);
                if (delimiter != null) {
                    emit(delimiter, text);
                } else if (CharClass.isWhitespace(c)) {
                    advance(text);
                } else if (CharClass.isLetter(c)) {
                    start(TokenType.SYMBOL, text, ScanState.SYMBOL);
                    advance(text);
                } else if (CharClass.isDigit(c)) {
                    start(TokenType.INTEGER, text, ScanState.NUMBER);
                    advance(text);
                } else {
                    throw unexpected(c);
                }
            }
        }
    }

    private void scanDispatch() {
        int next = peekNext();
        if (next == '{') {
            emit(TokenType.SET_OPEN, "#{");
        } else if (next == '_') {
            emit(TokenType.DISCARD, "#_");
        } else {
            // Only the '#' is consumed; a following ':' is scanned as part of the symbol.
            start(next == ':' ? TokenType.NS_MAP : TokenType.TAG, "", ScanState.SYMBOL);
            advance("#");
        }
    }

    private void scanComment(int c) {
        if (c == '\n' || c == '\r') {
            advance(text(c));
            finishToken();
        } else if (c == ';') {
            advance(";");
        } else {
            consume(text(c));
        }
    }

    private void checkLiteral(int c) {
        if (CharClass.isSeparator(c)) {
            finishToken();
        } else {
            // nil/true/false turned out to be the prefix of a symbol; nothing is rescanned.
            builder.retype(TokenType.SYMBOL);
            state = ScanState.SYMBOL;
        }
    }

    private void scanString(int c) {
        if (c == '\\') {
            int escaped = peekNext();
            if (escaped == -1) {
                throw new UnfinishedTokenException(builder.current());
            }
            advance("\\");
            builder.append(decodeEscape(escaped));
            advance(text(escaped));
        } else if (c == '"') {
            advance("\"");
            finishToken();
        } else {
            consume(text(c));
        }
    }

    private void scanSymbol(int c) {
        if (c == '/') {
            if (builder.valueContains('/')) {
                throw unexpected(c);
            }
            consume("/");
        } else if (CharClass.isSymbolChar(c)) {
            consume(text(c));
        } else {
            finishToken();
        }
    }

    private void scanNumber(int c) {
        switch (c) {
            case '.' -> {
                consume(".");
                builder.retype(TokenType.FLOAT);
                state = ScanState.FRACTION;
            }
            case 'e', 'E' -> {
                consume(text(c));
                builder.retype(TokenType.FLOAT);
                state = ScanState.EXPONENT;
            }
            case 'N' -> {
                consume("N");
                finishToken();
            }
            case 'M' -> {
                consume("M");
                builder.retype(TokenType.FLOAT);
                finishToken();
            }
            default -> {
                if (CharClass.isDigit(c)) {
                    consume(text(c));
                } else if (CharClass.isSeparator(c)) {
                    finishToken();
                } else {
                    throw unexpected(c);
                }
            }
        }
    }

    /**
     * Handles the character after '.', 'e' or an exponent sign: a digit is required.
     */
    private void scanNumberPart(int c) {
        if (state == ScanState.EXPONENT && (c == '-' || c == '+')) {
            consume(text(c));
        } else if (CharClass.isDigit(c)) {
            consume(text(c));
            state = ScanState.NUMBER;
        } else if (CharClass.isSeparator(c)) {
            throw new UnfinishedTokenException(builder.current());
        } else {
            throw unexpected(c);
        }
    }

    private void finishInput() {
        switch (state) {
            case STRING, CHARACTER, FRACTION, EXPONENT -> throw new UnfinishedTokenException(builder.current());
            default -> {
                if (builder.isActive()) {
                    finishToken();
                }
            }
        }
    }

    private String decodeEscape(int c) {
        switch (c) {
            case '"': return "\"";
            case 't': return "\t";
            case 'r': return "\r";
            case 'n': return "\n";
            case '\\': return "\\";
            default: throw unexpected(c);
        }
    }

    private TokenType literalAt() {
        if (source.startsWith("nil", current)) return TokenType.NIL;
        if (source.startsWith("true", current)) return TokenType.TRUE;
        if (source.startsWith("false", current)) return TokenType.FALSE;
        return null;
    }

    private static String literalText(TokenType literal) {
        return switch (literal) {
            case NIL -> "nil";
            case TRUE -> "true";
            case FALSE -> "false";
            default -> throw new IllegalArgumentException("Not a literal: " + literal);
        };
    }

    // Token Builder shortcuts. begin() must run before the cursor moves past the token's first character.

    private void start(TokenType type, String initialValue, ScanState next) {
        builder.begin(type, initialValue);
        state = next;
    }

    private void emit(TokenType type, String text) {
        builder.begin(type, text);
        advance(text);
        finishToken();
    }

    private void finishToken() {
        builder.finish();
        state = ScanState.NEW;
    }

    private void consume(String text) {
        builder.append(text);
        advance(text);
    }

    private void advance(String raw) {
        current += raw.length();
        cursor.advance(raw);
    }

    private UnexpectedInputException unexpected(int c) {
        return new UnexpectedInputException(text(c), cursor.position());
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private int peek() {
        return source.codePointAt(current);
    }

    private int peekNext() {
        int next = current + Character.charCount(peek());
        if (next >= source.length()) return -1;
        return source.codePointAt(next);
    }

    private static String text(int codePoint) {
        return new String(Character.toChars(codePoint));
    }
}
