package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

/**
 * 比较。结果为 Bool；{@code operandSort} 是两个操作数统一后的 sort。
 */
@Getter
public final class Compare extends Expression {

    private final RelationType relation;
    private final Expression left;
    private final Expression right;
    private final Sort operandSort;

    private final int hashCode;

    Compare(RelationType relation, Expression left, Expression right, Sort operandSort) {
        super(Sort.BOOL);
        this.relation = relation;
        this.left = left;
        this.right = right;
        this.operandSort = operandSort;
        this.hashCode = Objects.hash(relation, left, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Compare that = (Compare) o;
        return relation == that.relation && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " " + relation.getSymbol() + " " + right + ")";
    }
}
