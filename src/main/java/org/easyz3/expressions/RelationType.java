package org.easyz3.expressions;

/**
 * 比较运算符。结果 sort 恒为 Bool。
 */
public enum RelationType {

    EQ("=="),   // Equal
    NE("!="),   // Not Equal
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">=");   // Greater Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 只有 EQ 和 NE 可以用于 Bool 操作数。
     */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /**
     * 根据 compareTo 的结果判断关系是否成立。
     * @param comparison left.compareTo(right)
     */
    public boolean holds(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }
}
