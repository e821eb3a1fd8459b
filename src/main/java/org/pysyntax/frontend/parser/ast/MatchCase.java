package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code case} clause of a match statement.
 *
 * @param pattern The pattern.
 * @param guard The {@code if} guard, or null.
 * @param body The clause body.
 */
public record MatchCase(Pattern pattern, Expression guard, List<Statement> body) {

    public MatchCase {
        Objects.requireNonNull(pattern, "pattern");
        body = AstLists.copy(body);
    }
}
