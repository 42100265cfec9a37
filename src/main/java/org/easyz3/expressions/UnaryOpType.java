package org.easyz3.expressions;

public enum UnaryOpType {
    NEG("-"),
    POS("+"),
    NOT("!");

    private final String symbol;

    UnaryOpType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
