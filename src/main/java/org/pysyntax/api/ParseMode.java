package org.pysyntax.api;

/**
 * Selects the start symbol of the grammar and with it the kind of {@link org.pysyntax.frontend.parser.ast.Module}
 * that a parse returns.
 */
public enum ParseMode {
    /** A module of statements. Produces {@code Module.Program}. */
    EXEC,
    /** A unit typed at an interactive prompt. Produces {@code Module.Interactive}. */
    INTERACTIVE,
    /** A single expression. Produces {@code Module.Eval}. */
    EVAL,
    /** A signature type comment {@code (int, str) -> bool}. Produces {@code Module.FunctionType}. */
    FUNC_TYPE
}
