package org.pysyntax.frontend.lexer;

import java.util.List;

/**
 * The value of an {@link TokenType#FSTRING} token: literal text interleaved with replacement fields.
 *
 * @param parts The parts in source order.
 */
public record FStringLiteral(List<FStringPart> parts) {

    public FStringLiteral {
        parts = List.copyOf(parts);
    }
}
