package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;

import java.util.Objects;

/**
 * 符号表达式树的节点。
 * 所有节点在构造时确定 sort，之后不可变，可以在多个约束之间共享子树。
 * equals/hashCode 基于结构。
 * <p>
 * 节点只能通过 {@link Expressions} 的工厂方法或下面的链式方法构造，类型检查在构造时完成。
 */
@Getter
public abstract class Expression {

    private final Sort sort;

    protected Expression(Sort sort) {
        this.sort = Objects.requireNonNull(sort, "sort 不能为 null");
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    // --- 链式构造，均委托给 Expressions ---

    public Expression add(Object other) {
        return Expressions.add(this, other);
    }

    public Expression subtract(Object other) {
        return Expressions.subtract(this, other);
    }

    public Expression multiply(Object other) {
        return Expressions.multiply(this, other);
    }

    public Expression divide(Object other) {
        return Expressions.divide(this, other);
    }

    public Expression intDivide(Object other) {
        return Expressions.intDivide(this, other);
    }

    public Expression mod(Object other) {
        return Expressions.mod(this, other);
    }

    public Expression power(Object exponent) {
        return Expressions.power(this, exponent);
    }

    public Expression negate() {
        return Expressions.negate(this);
    }

    public Expression plus() {
        return Expressions.plus(this);
    }

    public Expression eq(Object other) {
        return Expressions.eq(this, other);
    }

    public Expression ne(Object other) {
        return Expressions.ne(this, other);
    }

    public Expression lt(Object other) {
        return Expressions.lt(this, other);
    }

    public Expression le(Object other) {
        return Expressions.le(this, other);
    }

    public Expression gt(Object other) {
        return Expressions.gt(this, other);
    }

    public Expression ge(Object other) {
        return Expressions.ge(this, other);
    }

    public Expression and(Object other) {
        return Expressions.and(this, other);
    }

    public Expression or(Object other) {
        return Expressions.or(this, other);
    }

    public Expression xor(Object other) {
        return Expressions.xor(this, other);
    }

    public Expression not() {
        return Expressions.not(this);
    }

    public Expression implies(Object consequent) {
        return Expressions.implies(this, consequent);
    }

    /**
     * {@code antecedent => this}。
     */
    public Expression impliedBy(Object antecedent) {
        return Expressions.impliedBy(this, antecedent);
    }
}
