package org.pysyntax.frontend.parser.ast;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    INVERT("~"),
    NOT("not"),
    UADD("+"),
    USUB("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
