package org.easyz3.expressions;

/**
 * 二元算术运算符。
 * DIV 是实数除法；INT_DIV 和 MOD 只用于 Int，语义同 SMT-LIB 的 div/mod（余数非负）。
 */
public enum ArithOpType {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    INT_DIV("div"),
    MOD("mod"),
    POW("**");

    private final String symbol;

    ArithOpType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
