package org.pysyntax.api;

/**
 * Thrown when source text is not valid Python. It is the common base of {@link TokenizeException} and
 * {@link ParseException}, so callers that only care about "valid or not" catch this one.
 * <p>
 * Positions are 1-based. The message returned by {@link #getMessage()} includes the position; the bare
 * description is available from {@link #getDetail()}.
 */
public class SyntaxException extends Exception {

    private final String detail;
    private final int line;
    private final int column;

    /**
     * Constructs a new syntax exception.
     * @param detail The description of the problem.
     * @param line The line of the problem.
     * @param column The column of the problem.
     */
    public SyntaxException(String detail, int line, int column) {
        super(String.format("%s at line %d, column %d", detail, line, column));
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return A short hint on how to fix the problem, or null if none is known.
     */
    public String getSuggestion() {
        return null;
    }
}
