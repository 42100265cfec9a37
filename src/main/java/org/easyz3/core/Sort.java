package org.easyz3.core;

import lombok.Getter;
import org.easyz3.exceptions.InvalidArityException;
import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 符号值的类型。标量 sort 只有 {@link #INT}、{@link #REAL}、{@link #BOOL} 三个实例，
 * 函数 sort 通过 {@link #function(List, Sort)} 创建，定义域和值域只能是标量。
 * 此类是不可变的。
 */
@Getter
public final class Sort {

    private static final Logger logger = LoggerFactory.getLogger(Sort.class);

    public static final Sort INT = new Sort(SortKind.INT, Collections.emptyList(), null);
    public static final Sort REAL = new Sort(SortKind.REAL, Collections.emptyList(), null);
    public static final Sort BOOL = new Sort(SortKind.BOOL, Collections.emptyList(), null);

    private final SortKind kind;
    // 仅函数 sort 使用
    private final List<Sort> domain;
    private final Sort range;

    private final int hashCode;

    private Sort(SortKind kind, List<Sort> domain, Sort range) {
        this.kind = kind;
        this.domain = domain;
        this.range = range;
        this.hashCode = Objects.hash(kind, domain, range);
    }

    /**
     * 工厂方法：创建函数 sort。
     * @param domain 参数 sort 列表，不能为空，元素必须是标量 sort。
     * @param range 值域，必须是标量 sort。
     * @return 函数 sort。
     * @throws InvalidArityException 定义域为空。
     * @throws SortMismatchException 定义域或值域中出现函数 sort。
     */
    public static Sort function(List<Sort> domain, Sort range) {
        Objects.requireNonNull(domain, "domain 不能为 null");
        Objects.requireNonNull(range, "range 不能为 null");
        if (domain.isEmpty()) {
            logger.error("函数 sort 的定义域为空");
            throw new InvalidArityException("函数 sort 至少需要一个参数，标量请直接使用 Int/Real/Bool");
        }
        for (Sort s : domain) {
            if (!Objects.requireNonNull(s, "domain 中的 sort 不能为 null").isScalar()) {
                logger.error("函数 sort 的定义域中出现非标量 sort: {}", s);
                throw new SortMismatchException("函数的参数只能是 Int/Real/Bool，实际为 " + s);
            }
        }
        if (!range.isScalar()) {
            logger.error("函数 sort 的值域不是标量: {}", range);
            throw new SortMismatchException("函数的值域只能是 Int/Real/Bool，实际为 " + range);
        }
        return new Sort(SortKind.FUNC, List.copyOf(domain), range);
    }

    public static Sort function(Sort range, Sort... domain) {
        return function(List.of(domain), range);
    }

    public boolean isNumeric() {
        return kind == SortKind.INT || kind == SortKind.REAL;
    }

    public boolean isScalar() {
        return kind != SortKind.FUNC;
    }

    public boolean isFunction() {
        return kind == SortKind.FUNC;
    }

    public int getArity() {
        return domain.size();
    }

    /**
     * 数值类型的统一：任意一方为 Real 时结果为 Real，否则为 Int。
     * @return 统一后的 sort；任一方不是数值类型时返回 null。
     */
    public static Sort unifyNumeric(Sort a, Sort b) {
        if (!a.isNumeric() || !b.isNumeric()) {
            return null;
        }
        return (a == REAL || b == REAL) ? REAL : INT;
    }

    /**
     * 检查 {@code actual} 能否出现在期望 {@code this} 的位置上（相等，或 Int 提升为 Real）。
     */
    public boolean accepts(Sort actual) {
        return this.equals(actual) || (this == REAL && actual == INT);
    }

    /**
     * 把一个 Java 值规范化为此标量 sort 的内部表示：
     * Int 为 {@link BigInteger}，Real 为 {@link Rational}，Bool 为 {@link Boolean}。
     * Int 型的 Java 值可以用于 Real。
     * @throws SortMismatchException 值的类型与此 sort 不兼容。
     */
    public Object coerceValue(Object value) {
        Objects.requireNonNull(value, "值不能为 null");
        switch (kind) {
            case BOOL:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            case INT:
                if (value instanceof BigInteger) {
                    return value;
                }
                if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                    return BigInteger.valueOf(((Number) value).longValue());
                }
                break;
            case REAL:
                if (value instanceof Rational) {
                    return value;
                }
                if (value instanceof BigInteger bi) {
                    return Rational.valueOf(bi);
                }
                if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                    return Rational.valueOf(((Number) value).longValue());
                }
                if (value instanceof BigDecimal bd) {
                    return Rational.valueOf(bd);
                }
                if (value instanceof Double || value instanceof Float) {
                    return Rational.valueOf(((Number) value).doubleValue());
                }
                break;
            default:
                break;
        }
        logger.error("值 {} ({}) 不能用作 {}", value, value.getClass().getSimpleName(), this);
        throw new SortMismatchException("值 " + value + " 的类型 " + value.getClass().getSimpleName() + " 与 " + this + " 不兼容");
    }

    /**
     * 此标量 sort 的默认值，用于模型中未出现的符号。
     */
    public Object defaultValue() {
        return switch (kind) {
            case INT -> BigInteger.ZERO;
            case REAL -> Rational.ZERO;
            case BOOL -> Boolean.FALSE;
            case FUNC -> throw new IllegalStateException("函数 sort 没有标量默认值: " + this);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sort sort = (Sort) o;
        return kind == sort.kind && domain.equals(sort.domain) && Objects.equals(range, sort.range);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (kind != SortKind.FUNC) {
            return kind.getSymbol();
        }
        return "(" + domain.stream().map(Sort::toString).collect(Collectors.joining(", ")) + ") -> " + range;
    }
}
