package org.easyz3.expressions;

/**
 * 布尔连接词。取反用 {@link UnaryOpType#NOT} 表示。
 */
public enum BoolOpType {
    AND("&"),
    OR("|"),
    XOR("^");

    private final String symbol;

    BoolOpType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
