package org.pysyntax.frontend.parser.ast;

import java.util.Objects;

/**
 * A keyword argument in a call or class definition.
 *
 * @param arg The keyword, or null for a {@code **mapping} unpacking.
 * @param value The argument value.
 * @param range The source range.
 */
public record Keyword(String arg, Expression value, SourceRange range) implements AstNode {

    public Keyword {
        Objects.requireNonNull(value, "value");
        range = AstLists.range(range);
    }
}
