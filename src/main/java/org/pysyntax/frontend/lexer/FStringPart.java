package org.pysyntax.frontend.lexer;

import java.util.List;

/**
 * A piece of an f-string.
 */
public sealed interface FStringPart {

    /**
     * Decoded literal text, with doubled braces already collapsed.
     * @param value The text.
     */
    record Text(String value) implements FStringPart {
    }

    /**
     * A replacement field {@code {expression=!r:spec}}.
     *
     * @param tokens The tokens of the expression, ending with END_OF_FILE.
     * @param expressionText The expression as written.
     * @param debugText For {@code {x = }}, the text {@code "x = "} that is printed before the value; otherwise null.
     * @param conversion The conversion character {@code s}, {@code r} or {@code a}, or -1.
     * @param formatSpec The parts of the format spec, or null when there is no {@code :}.
     * @param line The line of the opening brace.
     * @param column The column of the opening brace.
     */
    record Field(
            List<Token> tokens,
            String expressionText,
            String debugText,
            int conversion,
            List<FStringPart> formatSpec,
            int line,
            int column
    ) implements FStringPart {
        public Field {
            tokens = List.copyOf(tokens);
            formatSpec = formatSpec == null ? null : List.copyOf(formatSpec);
        }
    }
}
