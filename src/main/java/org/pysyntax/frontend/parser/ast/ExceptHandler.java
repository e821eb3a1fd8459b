package org.pysyntax.frontend.parser.ast;

import java.util.List;

/**
 * An {@code except} (or {@code except*}) clause.
 *
 * @param type The exception type expression, or null for a bare {@code except:}.
 * @param name The bound name after {@code as}, or null.
 * @param body The handler body.
 * @param range The source range.
 */
public record ExceptHandler(Expression type, String name, List<Statement> body, SourceRange range)
        implements AstNode {

    public ExceptHandler {
        body = AstLists.copy(body);
        range = AstLists.range(range);
        if (name != null && type == null) {
            throw new IllegalArgumentException("A bare except cannot bind a name");
        }
    }
}
