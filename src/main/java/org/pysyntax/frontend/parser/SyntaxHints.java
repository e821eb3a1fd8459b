package org.pysyntax.frontend.parser;

import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Derives human-friendly explanations for common syntax mistakes.
 */
final class SyntaxHints {

    private SyntaxHints() {
    }

    /**
     * Finds the innermost bracket that is still open before the given token index.
     *
     * @param tokens The token stream.
     * @param end The index of the offending token (exclusive).
     * @return The opening token, or null if all brackets are balanced.
     */
    static Token unclosedBracket(List<Token> tokens, int end) {
        Deque<Token> open = new ArrayDeque<>();
        for (int i = 0; i < end && i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> open.push(token);
                case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> {
                    if (!open.isEmpty()) {
                        open.pop();
                    }
                }
                default -> {
                }
            }
        }
        return open.peek();
    }

    /**
     * @param opener An opening bracket token.
     * @return The closing bracket that matches it.
     */
    static TokenType closerOf(Token opener) {
        switch (opener.type()) {
            case LEFT_PAREN: return TokenType.RIGHT_PAREN;
            case LEFT_BRACKET: return TokenType.RIGHT_BRACKET;
            default: return TokenType.RIGHT_BRACE;
        }
    }

    static boolean isCloser(TokenType type) {
        return type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET || type == TokenType.RIGHT_BRACE;
    }

    /**
     * Renders the source line with a missing character inserted, e.g. {@code if x > 3:}.
     *
     * @param source The full source, or null.
     * @param line The 1-based line.
     * @param column The 1-based column at which to insert.
     * @param insert The text to insert.
     * @return The fixed line, trimmed, or null if the source is not available.
     */
    static String fixedLine(String source, int line, int column, String insert) {
        String text = sourceLine(source, line);
        if (text == null) {
            return null;
        }
        int at = Math.min(Math.max(column - 1, 0), text.length());
        return (text.substring(0, at) + insert + text.substring(at)).strip();
    }

    /**
     * @return The given 1-based line of the source without its line break, or null.
     */
    static String sourceLine(String source, int line) {
        if (source == null || line < 1) {
            return null;
        }
        String[] lines = source.split("\r\n|\r|\n", -1);
        return line <= lines.length ? lines[line - 1] : null;
    }
}
