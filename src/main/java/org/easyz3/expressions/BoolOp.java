package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
public final class BoolOp extends Expression {

    private final BoolOpType op;
    private final List<Expression> operands;

    private final int hashCode;

    BoolOp(BoolOpType op, List<Expression> operands) {
        super(Sort.BOOL);
        this.op = op;
        this.operands = List.copyOf(operands);
        this.hashCode = Objects.hash(op, this.operands);
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
        BoolOp that = (BoolOp) o;
        return op == that.op && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(" " + op.getSymbol() + " ", "(", ")"));
    }
}
