package org.eden.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link CharClass} predicates.
 */
@Tag("unit")
class CharClassTest {

    @Test
    void symbolCharsAreExactlyTheDocumentedSet() {
        String allowed = "_?abcxyzABCXYZ0189.*+!-$%&=<>#:|";
        for (char c : allowed.toCharArray()) {
            assertThat(CharClass.isSymbolChar(c)).as("'%s'", c).isTrue();
        }
        for (char c : "/\\\"'@^~`;,(){}[] \n".toCharArray()) {
            assertThat(CharClass.isSymbolChar(c)).as("'%s'", c).isFalse();
        }
        assertThat(CharClass.isSymbolChar('λ')).isFalse();
    }

    @Test
    void lettersAndDigitsAreAscii() {
        assertThat(CharClass.isLetter('q')).isTrue();
        assertThat(CharClass.isLetter('Q')).isTrue();
        assertThat(CharClass.isLetter('é')).isFalse();
        assertThat(CharClass.isLetter('_')).isFalse();
        assertThat(CharClass.isDigit('7')).isTrue();
        assertThat(CharClass.isDigit('٣')).isFalse();
    }

    @Test
    void separatorsAreWhitespaceCommaAndDelimiters() {
        for (char c : " \t\n\r\f\u000B,{}[]()".toCharArray()) {
            assertThat(CharClass.isSeparator(c)).as("'%s'", c).isTrue();
        }
        assertThat(CharClass.isSeparator('"')).isFalse();
        assertThat(CharClass.isSeparator(';')).isFalse();
        assertThat(CharClass.isWhitespace('{')).isFalse();
    }

    @Test
    void delimitersMapToTheirTypes() {
        assertThat(CharClass.delimiterType('{')).isEqualTo(TokenType.CURLY_OPEN);
        assertThat(CharClass.delimiterType('}')).isEqualTo(TokenType.CURLY_CLOSE);
        assertThat(CharClass.delimiterType('[')).isEqualTo(TokenType.BRACKET_OPEN);
        assertThat(CharClass.delimiterType(']')).isEqualTo(TokenType.BRACKET_CLOSE);
        assertThat(CharClass.delimiterType('(')).isEqualTo(TokenType.PAREN_OPEN);
        assertThat(CharClass.delimiterType(')')).isEqualTo(TokenType.PAREN_CLOSE);
        assertThat(CharClass.delimiterType('<')).isNull();
    }
}
