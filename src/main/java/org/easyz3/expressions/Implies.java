package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

@Getter
public final class Implies extends Expression {

    private final Expression antecedent;
    private final Expression consequent;

    private final int hashCode;

    Implies(Expression antecedent, Expression consequent) {
        super(Sort.BOOL);
        this.antecedent = antecedent;
        this.consequent = consequent;
        this.hashCode = Objects.hash(Implies.class, antecedent, consequent);
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
        Implies that = (Implies) o;
        return antecedent.equals(that.antecedent) && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + antecedent + " => " + consequent + ")";
    }
}
