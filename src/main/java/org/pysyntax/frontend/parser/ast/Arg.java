package org.pysyntax.frontend.parser.ast;

import java.util.Objects;

/**
 * A single parameter of a function or lambda.
 *
 * @param name The parameter name.
 * @param annotation The annotation, or null. Lambda parameters never have one.
 * @param range The source range of the parameter.
 */
public record Arg(String name, Expression annotation, SourceRange range) implements AstNode {

    public Arg {
        Objects.requireNonNull(name, "name");
        range = AstLists.range(range);
    }

    public Arg(String name) {
        this(name, null, SourceRange.NONE);
    }
}
