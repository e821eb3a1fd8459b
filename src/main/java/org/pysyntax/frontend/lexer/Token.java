package org.pysyntax.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Tokenizer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (a decoded number or string), or null.
 * @param line The 1-based line where the token begins.
 * @param column The 1-based column where the token begins.
 * @param endLine The line where the token ends.
 * @param endColumn The column just after the last character of the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int endLine,
        int endColumn
) {

    /**
     * @param other The identifier text to compare against.
     * @return True if this token is a NAME with exactly the given text.
     */
    public boolean isName(String other) {
        return type == TokenType.NAME && text.equals(other);
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}
