package org.easyz3.core;

/**
 * 支持的四种 sort。
 */
public enum SortKind {
    INT("Int"),
    REAL("Real"),
    BOOL("Bool"),
    FUNC("Func");

    private final String symbol;

    SortKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
