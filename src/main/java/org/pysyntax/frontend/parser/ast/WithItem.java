package org.pysyntax.frontend.parser.ast;

import java.util.Objects;

/**
 * A context manager of a {@code with} statement.
 *
 * @param contextExpr The context manager expression.
 * @param optionalVars The {@code as} target, or null.
 */
public record WithItem(Expression contextExpr, Expression optionalVars) {

    public WithItem {
        Objects.requireNonNull(contextExpr, "contextExpr");
    }
}
