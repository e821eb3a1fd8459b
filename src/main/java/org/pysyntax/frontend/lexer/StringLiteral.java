package org.pysyntax.frontend.lexer;

/**
 * The decoded value of a {@link TokenType#STRING} token.
 *
 * @param value The decoded text. For bytes literals every char is in the range 0-255.
 * @param bytes True for a {@code b''} literal.
 * @param unicodePrefix True if the literal was written with a {@code u} prefix.
 */
public record StringLiteral(String value, boolean bytes, boolean unicodePrefix) {
}
