package org.pysyntax.diagnostics;

import org.pysyntax.api.ParseException;
import org.pysyntax.api.SyntaxException;
import org.pysyntax.api.TokenizeException;

import java.util.Locale;

/**
 * Represents a single diagnostic message anchored at a position in the source.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred, or null for in-memory source.
 * @param line The 1-based line of the issue.
 * @param column The 1-based column of the issue.
 * @param suggestion A hint on how to fix the issue, or null.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int line,
        int column,
        String suggestion
) {
    private static final String GENERIC_PARSE_MESSAGE = "invalid syntax";

    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents parsing. */
        ERROR,
        /** A warning that does not prevent parsing. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * Converts a syntax error into a diagnostic for in-memory source.
     */
    public static Diagnostic of(SyntaxException e) {
        return of(e, null);
    }

    /**
     * Converts a syntax error into a diagnostic.
     *
     * @param e The tokenizer or parser error.
     * @param fileName The name of the source file, or null.
     * @return The diagnostic.
     */
    public static Diagnostic of(SyntaxException e, String fileName) {
        String message = e.getDetail();
        if (e instanceof TokenizeException tokenizeException) {
            message = message + " (" + tokenizeException.getKind().name().toLowerCase(Locale.ROOT).replace('_', ' ') + ")";
        } else if (e instanceof ParseException parseException && parseException.getFound() != null
                && message.equals(GENERIC_PARSE_MESSAGE)) {
            message = message + ", found " + parseException.getFound().type().describe();
        }
        return new Diagnostic(Type.ERROR, message, fileName, e.getLine(), e.getColumn(), e.getSuggestion());
    }

    /**
     * Renders the diagnostic with the offending source line and a caret under the column:
     * <pre>
     * [ERROR] 1:9: expected ':'
     *     if x > 3
     *             ^
     * help: did you mean 'if x > 3:'?
     * </pre>
     *
     * @param source The source text the positions refer to, or null to render the header only.
     * @return The rendered text without a trailing newline.
     */
    public String format(String source) {
        StringBuilder sb = new StringBuilder(toString());
        String sourceLine = sourceLine(source, line);
        if (sourceLine != null) {
            sb.append('\n').append("    ").append(sourceLine);
            sb.append('\n').append("    ").append(caretPadding(sourceLine, column)).append('^');
        }
        if (suggestion != null) {
            sb.append('\n').append("help: ").append(suggestion);
        }
        return sb.toString();
    }

    private static String sourceLine(String source, int line) {
        if (source == null || line < 1) {
            return null;
        }
        String[] lines = source.split("\r\n|\r|\n", -1);
        return line <= lines.length ? lines[line - 1] : null;
    }

    /**
     * Keeps tabs so that the caret lines up with the column in a terminal.
     */
    private static String caretPadding(String sourceLine, int column) {
        StringBuilder padding = new StringBuilder();
        int width = Math.min(Math.max(column - 1, 0), sourceLine.length());
        for (int i = 0; i < width; i++) {
            padding.append(sourceLine.charAt(i) == '\t' ? '\t' : ' ');
        }
        return padding.toString();
    }

    @Override
    public String toString() {
        if (fileName == null) {
            return String.format("[%s] %d:%d: %s", type, line, column, message);
        }
        return String.format("[%s] %s:%d:%d: %s", type, fileName, line, column, message);
    }
}
