package org.pysyntax.frontend.lexer;

/**
 * The value of an imaginary number token such as {@code 2.5j}.
 *
 * @param imag The imaginary part.
 */
public record ImaginaryLiteral(double imag) {
}
