package io.safecalc.core.model;

/** Prefix operators. */
public enum UnaryOperator {
    NEGATE("-"),
    IDENTITY("+");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /** Canonical ASCII spelling. */
    public String symbol() {
        return symbol;
    }
}
