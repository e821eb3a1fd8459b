package org.pysyntax.api;

/**
 * A lexical error: the text could not be split into tokens.
 */
public class TokenizeException extends SyntaxException {

    /**
     * The kinds of lexical errors. Tests assert on these rather than on message text.
     */
    public enum Kind {
        /** A dedent does not return to any enclosing indentation level. */
        INDENTATION_MISMATCH,
        /** A string literal runs into the end of the line or of the input. */
        UNTERMINATED_LITERAL,
        /** A character that cannot start any token, or that is not allowed in its literal. */
        INVALID_CHARACTER,
        /** A malformed numeric literal. */
        INVALID_NUMBER,
        /** More than 200 brackets are open at once. */
        TOO_DEEPLY_NESTED
    }

    private final Kind kind;

    /**
     * Constructs a new tokenize exception.
     * @param kind The kind of error.
     * @param detail The description.
     * @param line The line of the problem.
     * @param column The column of the problem.
     */
    public TokenizeException(Kind kind, String detail, int line, int column) {
        super(detail, line, column);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
