package org.pysyntax.frontend.parser.ast;

/**
 * A span of source text. Lines and columns are 1-based, the end column is exclusive.
 * An {@code endLine} of 0 means the end is unknown.
 *
 * @param line The first line of the span.
 * @param column The first column of the span.
 * @param endLine The last line of the span, or 0.
 * @param endColumn The column just after the span, or 0.
 */
public record SourceRange(int line, int column, int endLine, int endColumn) {

    /** The range of synthetic nodes that were not parsed from text. */
    public static final SourceRange NONE = new SourceRange(0, 0, 0, 0);

    public SourceRange {
        if (line < 0 || column < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Negative position in range " + line + ":" + column);
        }
        if (endLine != 0 && (endLine < line || (endLine == line && endColumn < column))) {
            throw new IllegalArgumentException(String.format(
                    "Range end %d:%d lies before its start %d:%d", endLine, endColumn, line, column));
        }
    }

    /**
     * Creates a range that starts where {@code first} starts and ends where {@code last} ends.
     * @param first The node or range providing the start.
     * @param last The node or range providing the end.
     * @return The spanning range.
     */
    public static SourceRange span(SourceRange first, SourceRange last) {
        if (last.endLine() == 0) {
            return new SourceRange(first.line(), first.column(), first.endLine(), first.endColumn());
        }
        return new SourceRange(first.line(), first.column(), last.endLine(), last.endColumn());
    }

    public boolean hasEnd() {
        return endLine != 0;
    }

    @Override
    public String toString() {
        return hasEnd() ? line + ":" + column + "-" + endLine + ":" + endColumn : line + ":" + column;
    }
}
