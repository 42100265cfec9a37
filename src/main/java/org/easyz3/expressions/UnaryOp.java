package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

@Getter
public final class UnaryOp extends Expression {

    private final UnaryOpType op;
    private final Expression operand;

    private final int hashCode;

    UnaryOp(UnaryOpType op, Expression operand, Sort sort) {
        super(sort);
        this.op = op;
        this.operand = operand;
        this.hashCode = Objects.hash(op, operand);
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
        UnaryOp that = (UnaryOp) o;
        return op == that.op && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + op.getSymbol() + operand + ")";
    }
}
