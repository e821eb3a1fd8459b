package org.pysyntax.frontend.parser.ast;

import java.util.Objects;

/**
 * One imported name, e.g. {@code os.path as p}. The name is {@code *} for star imports.
 *
 * @param name The dotted module or member name.
 * @param asname The local alias, or null.
 * @param range The source range.
 */
public record Alias(String name, String asname, SourceRange range) implements AstNode {

    public Alias {
        Objects.requireNonNull(name, "name");
        range = AstLists.range(range);
    }
}
