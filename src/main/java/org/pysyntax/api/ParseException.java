package org.pysyntax.api;

import org.pysyntax.frontend.lexer.Token;

import java.util.List;

/**
 * A grammatical error: the tokens do not form a valid program.
 */
public class ParseException extends SyntaxException {

    private final List<String> expected;
    private final Token found;
    private final String suggestion;

    /**
     * Constructs a new parse exception.
     * @param detail The description of the problem.
     * @param expected Descriptions of what would have been accepted, possibly empty.
     * @param found The offending token, or null if the error is not tied to one token.
     * @param line The line of the problem.
     * @param column The column of the problem.
     * @param suggestion A fix hint, or null.
     */
    public ParseException(String detail, List<String> expected, Token found, int line, int column, String suggestion) {
        super(detail, line, column);
        this.expected = expected == null ? List.of() : List.copyOf(expected);
        this.found = found;
        this.suggestion = suggestion;
    }

    public ParseException(String detail, Token found, int line, int column) {
        this(detail, List.of(), found, line, column, null);
    }

    public List<String> getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    @Override
    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns a copy of this exception carrying the given suggestion.
     * @param newSuggestion The suggestion.
     * @return The new exception.
     */
    public ParseException withSuggestion(String newSuggestion) {
        return new ParseException(getDetail(), expected, found, getLine(), getColumn(), newSuggestion);
    }
}
