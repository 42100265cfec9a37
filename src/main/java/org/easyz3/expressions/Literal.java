package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

/**
 * 常量。Int 的值为 {@link java.math.BigInteger}，Real 为 {@link org.easyz3.utils.Rational}，Bool 为 {@link Boolean}。
 */
@Getter
public final class Literal extends Expression {

    private final Object value;

    private final int hashCode;

    Literal(Object value, Sort sort) {
        super(sort);
        this.value = Objects.requireNonNull(value, "value 不能为 null");
        this.hashCode = Objects.hash(value, sort);
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
        Literal literal = (Literal) o;
        return getSort().equals(literal.getSort()) && value.equals(literal.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
