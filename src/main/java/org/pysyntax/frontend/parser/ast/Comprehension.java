package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code for ... in ... if ...} clause of a comprehension.
 *
 * @param target The loop target, in store context.
 * @param iter The iterable.
 * @param ifs The guard conditions.
 * @param isAsync True for {@code async for}.
 */
public record Comprehension(Expression target, Expression iter, List<Expression> ifs, boolean isAsync) {

    public Comprehension {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iter, "iter");
        ifs = AstLists.copy(ifs);
    }
}
