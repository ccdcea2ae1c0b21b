package com.venn.expression;

/**
 * Operations of the set expression language, loosest binding first.
 */
public enum SetOperator {
    UNION("U"),
    DIFFERENCE("-"),
    SYMMETRIC_DIFFERENCE("^"),
    INTERSECTION("&"),
    COMPLEMENT("."),
    SET_REF(""),
    EMPTY("");

    private final String symbol;

    SetOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
