package org.pysyntax.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pysyntax.api.TokenizeException;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Tokenizer}.
 * These tests verify that source text is converted into the expected token stream, including the
 * layout tokens that encode indentation, and that lexical errors are reported with their kind and position.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class TokenizerTest {

    private static List<Token> tokenize(String source) throws TokenizeException {
        return new Tokenizer(source).tokenize();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    /**
     * Verifies the token stream of a simple assignment, including the NEWLINE and END_OF_FILE tokens.
     */
    @Test
    void testSimpleAssignment() throws Exception {
        // Arrange
        String source = "x = 1\n";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.NAME, "x"),
                tuple(TokenType.EQUAL, "="),
                tuple(TokenType.NUMBER, "1"),
                tuple(TokenType.NEWLINE, "\n"),
                tuple(TokenType.END_OF_FILE, ""));
        assertThat(tokens.get(2).value()).isEqualTo(BigInteger.ONE);
    }

    /**
     * Verifies that nested blocks produce INDENT and DEDENT tokens at the right places and that
     * a return to column one closes every open block.
     */
    @Test
    void testIndentAndDedent() throws Exception {
        // Arrange
        String source = String.join("\n",
                "if a:",
                "    b",
                "    if c:",
                "        d",
                "e",
                "");

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IF, TokenType.NAME, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.IF, TokenType.NAME, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.DEDENT,
                TokenType.NAME, TokenType.NEWLINE,
                TokenType.END_OF_FILE);
    }

    /**
     * Verifies that the end of input closes the open blocks and supplies the missing final NEWLINE.
     */
    @Test
    void testEndOfInputClosesBlocks() throws Exception {
        // Arrange
        String source = "def f():\n    return 1";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(types(tokens)).endsWith(
                TokenType.RETURN, TokenType.NUMBER, TokenType.NEWLINE, TokenType.DEDENT, TokenType.END_OF_FILE);
    }

    /**
     * Every INDENT is matched by exactly one DEDENT, whatever the shape of the input.
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "pass",
            "if a:\n    if b:\n        if c:\n            d",
            "class A:\n    def f(self):\n        pass\n\n    def g(self):\n        pass\nx = 1\n",
            "while x:\n\tif y:\n\t\tz()\n\telse:\n\t\tw()\n",
            "def f():\n    x = [\n  1,\n        2]\n    return x\n"
    })
    void testIndentsAreBalanced(String source) throws Exception {
        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        long indents = tokens.stream().filter(t -> t.type() == TokenType.INDENT).count();
        long dedents = tokens.stream().filter(t -> t.type() == TokenType.DEDENT).count();
        assertThat(indents).isEqualTo(dedents);
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that line breaks inside brackets do not produce NEWLINE or INDENT tokens.
     */
    @Test
    void testImplicitLineJoiningInsideBrackets() throws Exception {
        // Arrange
        String source = "x = (1,\n     2)\n";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.NAME, TokenType.EQUAL, TokenType.LEFT_PAREN, TokenType.NUMBER, TokenType.COMMA,
                TokenType.NUMBER, TokenType.RIGHT_PAREN, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    void testBackslashContinuationJoinsLines() throws Exception {
        // Act
        List<Token> tokens = tokenize("x = 1 + \\\n    2\n");

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER,
                TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that blank lines and comment-only lines produce no tokens at all.
     */
    @Test
    void testBlankAndCommentLinesAreSkipped() throws Exception {
        // Arrange
        String source = "a = 1\n\n   # comment\nb = 2  # trailing\n";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.END_OF_FILE);
        assertThat(tokens.get(4).line()).isEqualTo(4);
    }

    @Test
    void testWindowsLineEndingsAreNormalized() throws Exception {
        // Act
        List<Token> tokens = tokenize("a = 1\r\nb = 2\r\n");

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NAME)
                .extracting(Token::text, Token::line)
                .containsExactly(tuple("a", 1), tuple("b", 2));
    }

    /**
     * Verifies that a tab advances the indentation to the next multiple of eight, so a tab and
     * eight spaces denote the same level.
     */
    @Test
    void testTabsAndSpacesAtSameWidth() throws Exception {
        // Arrange
        String source = "if a:\n\tb\n        c\n";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).hasSize(1);
    }

    /**
     * Verifies the decoded values of the different numeric literal forms.
     */
    @Test
    void testNumberLiterals() throws Exception {
        // Arrange
        String source = "0xFF 0o17 0b1010 1_000 3.14 1e3 2j .5 123456789012345678901234567890";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NUMBER).extracting(Token::value).containsExactly(
                BigInteger.valueOf(255),
                BigInteger.valueOf(15),
                BigInteger.valueOf(10),
                BigInteger.valueOf(1000),
                3.14,
                1000.0,
                new ImaginaryLiteral(2.0),
                0.5,
                new BigInteger("123456789012345678901234567890"));
    }

    /**
     * Verifies escape decoding and prefix handling of plain, raw, bytes and unicode-prefixed strings.
     */
    @Test
    void testStringLiterals() throws Exception {
        // Arrange
        String source = "'a\\tb' r'a\\tb' b'\\x41' u\"x\" '\\N{BULLET}\\u00e9'";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.STRING).extracting(Token::value).containsExactly(
                new StringLiteral("a\tb", false, false),
                new StringLiteral("a\\tb", false, false),
                new StringLiteral("A", true, false),
                new StringLiteral("x", false, true),
                new StringLiteral("\u2022\u00e9", false, false));
    }

    @Test
    void testTripleQuotedStringSpansLines() throws Exception {
        // Act
        List<Token> tokens = tokenize("s = \"\"\"one\ntwo\"\"\"\n");

        // Assert
        Token string = tokens.get(2);
        assertThat(string.type()).isEqualTo(TokenType.STRING);
        assertThat(string.value()).isEqualTo(new StringLiteral("one\ntwo", false, false));
        assertThat(string.line()).isEqualTo(1);
        assertThat(string.endLine()).isEqualTo(2);
        assertThat(tokens.get(3).type()).isEqualTo(TokenType.NEWLINE);
    }

    /**
     * Verifies that an f-string is split into literal text and replacement fields with their
     * conversion and format spec.
     */
    @Test
    void testFStringParts() throws Exception {
        // Arrange
        String source = "f\"a{b!r:>10}c{{d}}\"";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.FSTRING);
        List<FStringPart> parts = ((FStringLiteral) tokens.get(0).value()).parts();
        assertThat(parts).hasSize(3);
        assertThat(parts.get(0)).isEqualTo(new FStringPart.Text("a"));
        FStringPart.Field field = (FStringPart.Field) parts.get(1);
        assertThat(field.expressionText()).isEqualTo("b");
        assertThat(field.conversion()).isEqualTo('r');
        assertThat(field.formatSpec()).containsExactly(new FStringPart.Text(">10"));
        assertThat(field.tokens()).extracting(Token::type).containsExactly(TokenType.NAME, TokenType.END_OF_FILE);
        assertThat(parts.get(2)).isEqualTo(new FStringPart.Text("c{d}"));
    }

    @Test
    void testFStringDebugField() throws Exception {
        // Act
        List<Token> tokens = tokenize("f'{value = }'");

        // Assert
        FStringPart.Field field = (FStringPart.Field) ((FStringLiteral) tokens.get(0).value()).parts().get(0);
        assertThat(field.debugText()).isEqualTo("value = ");
        assertThat(field.expressionText()).isEqualTo("value ");
    }

    /**
     * Verifies that soft keywords stay plain names while hard keywords get their own token types.
     */
    @Test
    void testSoftKeywordsAreNames() throws Exception {
        // Act
        List<Token> tokens = tokenize("match case type _ if None");

        // Assert
        assertThat(types(tokens)).startsWith(
                TokenType.NAME, TokenType.NAME, TokenType.NAME, TokenType.NAME, TokenType.IF, TokenType.NONE);
    }

    @Test
    void testLongestOperatorWins() throws Exception {
        // Act
        List<Token> tokens = tokenize("a **= b // c -> d := e ... != f >>= g");

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() != TokenType.NAME)
                .extracting(Token::type)
                .containsExactly(TokenType.DOUBLE_STAR_EQUAL, TokenType.DOUBLE_SLASH, TokenType.ARROW,
                        TokenType.COLON_EQUAL, TokenType.ELLIPSIS, TokenType.NOT_EQUAL, TokenType.RIGHT_SHIFT_EQUAL,
                        TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    void testTokenPositions() throws Exception {
        // Act
        List<Token> tokens = tokenize("x = 10\n");

        // Assert
        assertThat(tokens.get(2)).extracting(Token::line, Token::column, Token::endLine, Token::endColumn)
                .containsExactly(1, 5, 1, 7);
    }

    /**
     * Verifies that a dedent to a column that was never an indentation level is rejected.
     */
    @Test
    void testIndentationMismatch() {
        // Arrange
        String source = "if a:\n        b\n    c\n";

        // Act & Assert
        assertThatThrownBy(() -> tokenize(source))
                .isInstanceOfSatisfying(TokenizeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(TokenizeException.Kind.INDENTATION_MISMATCH);
                    assertThat(e.getDetail()).isEqualTo("unindent does not match any outer indentation level");
                    assertThat(e.getLine()).isEqualTo(3);
                    assertThat(e.getColumn()).isEqualTo(5);
                });
    }

    @Test
    void testUnterminatedString() {
        assertThatThrownBy(() -> tokenize("s = 'abc\n"))
                .isInstanceOfSatisfying(TokenizeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(TokenizeException.Kind.UNTERMINATED_LITERAL);
                    assertThat(e.getLine()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo(5);
                });
    }

    @Test
    void testUnterminatedTripleQuotedString() {
        assertThatThrownBy(() -> tokenize("s = \"\"\"abc\nmore"))
                .isInstanceOf(TokenizeException.class)
                .hasMessageContaining("unterminated triple-quoted string literal");
    }

    @Test
    void testInvalidCharacter() {
        assertThatThrownBy(() -> tokenize("a = $"))
                .isInstanceOfSatisfying(TokenizeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(TokenizeException.Kind.INVALID_CHARACTER);
                    assertThat(e.getDetail()).isEqualTo("invalid character '$' (U+0024)");
                    assertThat(e.getColumn()).isEqualTo(5);
                });
    }

    /**
     * Malformed numeric literals are reported as INVALID_NUMBER.
     */
    @ParameterizedTest
    @ValueSource(strings = {"x = 012", "x = 0b102", "x = 1__0", "x = 0x", "x = 1e", "x = 12abc"})
    void testInvalidNumbers(String source) {
        assertThatThrownBy(() -> tokenize(source))
                .isInstanceOfSatisfying(TokenizeException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TokenizeException.Kind.INVALID_NUMBER));
    }

    /**
     * At most 200 brackets may be open at once; the bracket that exceeds the limit is reported.
     */
    @Test
    void testBracketNestingLimit() throws TokenizeException {
        // Arrange
        String atLimit = "x = " + "[".repeat(200) + "]".repeat(200) + "\ny = " + "(".repeat(200) + ")".repeat(200);
        String beyondLimit = "x = " + "[".repeat(201) + "]".repeat(201);

        // Act
        List<Token> tokens = tokenize(atLimit);

        // Assert
        assertThat(tokens).filteredOn(token -> token.type() == TokenType.LEFT_BRACKET).hasSize(200);
        assertThatThrownBy(() -> tokenize(beyondLimit))
                .isInstanceOfSatisfying(TokenizeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(TokenizeException.Kind.TOO_DEEPLY_NESTED);
                    assertThat(e.getDetail()).isEqualTo("too many nested parentheses");
                    assertThat(e.getLine()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo(205);
                });
    }

    @Test
    void testSingleClosingBraceInFString() {
        assertThatThrownBy(() -> tokenize("f'a}b'"))
                .isInstanceOf(TokenizeException.class)
                .hasMessageContaining("single '}' is not allowed");
    }
}
