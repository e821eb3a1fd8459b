package org.pysyntax.frontend.parser.ast;

/**
 * Binary arithmetic and bitwise operators, also used by augmented assignment.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    MAT_MULT("@"),
    DIV("/"),
    MOD("%"),
    POW("**"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_AND("&"),
    FLOOR_DIV("//");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The operator as written in source, e.g. {@code //}.
     */
    public String symbol() {
        return symbol;
    }
}
