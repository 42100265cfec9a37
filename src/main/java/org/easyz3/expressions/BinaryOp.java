package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

/**
 * 二元算术运算。sort 是两个操作数统一后的 sort（DIV 恒为 Real），
 * 编译时 Int 操作数会按需提升为 Real。
 */
@Getter
public final class BinaryOp extends Expression {

    private final ArithOpType op;
    private final Expression left;
    private final Expression right;

    private final int hashCode;

    BinaryOp(ArithOpType op, Expression left, Expression right, Sort sort) {
        super(sort);
        this.op = op;
        this.left = left;
        this.right = right;
        this.hashCode = Objects.hash(op, left, right);
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
        BinaryOp that = (BinaryOp) o;
        return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.getSymbol() + " " + right + ")";
    }
}
