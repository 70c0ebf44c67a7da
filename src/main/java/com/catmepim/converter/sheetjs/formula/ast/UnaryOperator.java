package com.catmepim.converter.sheetjs.formula.ast;

/**
 * Prefix operators. Unary plus is a no-op in formulas and never reaches the tree.
 */
public enum UnaryOperator {
    NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
