package org.pysyntax.backend.codegen;

/**
 * Binding strength of Python expression forms, weakest first. A child is parenthesized when its own
 * level is below the level its position requires.
 */
enum Precedence {
    NAMED_EXPR,
    TUPLE,
    YIELD,
    TEST,
    OR,
    AND,
    NOT,
    CMP,
    BOR,
    BXOR,
    BAND,
    SHIFT,
    ARITH,
    TERM,
    FACTOR,
    POWER,
    AWAIT,
    ATOM;

    /**
     * @return The next stronger level, or ATOM for ATOM itself.
     */
    Precedence next() {
        Precedence[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : ATOM;
    }

    boolean isBelow(Precedence other) {
        return ordinal() < other.ordinal();
    }
}
