package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Sort;
import org.easyz3.exceptions.SortMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一组已提交的约束，语义为所有约束的合取。
 * 保持提交顺序，使编译出的求解器输入可复现。
 * 此类是不可变的。
 */
@Getter
public final class ConstraintSet implements Iterable<Expression> {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintSet.class);

    // 表示恒真的空约束集
    public static final ConstraintSet EMPTY = new ConstraintSet(Collections.emptyList());

    private final List<Expression> constraints;

    private final int hashCode;

    private ConstraintSet(List<Expression> constraints) {
        this.constraints = Collections.unmodifiableList(constraints);
        this.hashCode = Objects.hash(this.constraints);
    }

    /**
     * 工厂方法：按给定顺序创建约束集。
     * @throws SortMismatchException 任一约束不是 Bool。
     */
    public static ConstraintSet of(List<? extends Expression> constraints) {
        List<Expression> copy = new ArrayList<>(constraints.size());
        for (Expression constraint : constraints) {
            copy.add(requireBool(constraint));
        }
        return new ConstraintSet(copy);
    }

    public static ConstraintSet of(Expression... constraints) {
        return of(List.of(constraints));
    }

    /**
     * 追加一个约束。
     * @return 追加后的新 ConstraintSet。
     * @throws SortMismatchException 约束不是 Bool。
     */
    public ConstraintSet and(Expression constraint) {
        List<Expression> newConstraints = new ArrayList<>(this.constraints);
        newConstraints.add(requireBool(constraint));
        logger.debug("对ConstraintSet{}和约束{}进行合取", this, constraint);
        return new ConstraintSet(newConstraints);
    }

    public ConstraintSet and(ConstraintSet other) {
        List<Expression> newConstraints = new ArrayList<>(this.constraints);
        newConstraints.addAll(other.constraints);
        return new ConstraintSet(newConstraints);
    }

    /**
     * 空约束集在语义上表示恒真。
     */
    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    public int size() {
        return constraints.size();
    }

    @Override
    public Iterator<Expression> iterator() {
        return constraints.iterator();
    }

    private static Expression requireBool(Expression constraint) {
        Objects.requireNonNull(constraint, "约束不能为 null");
        if (constraint.getSort() != Sort.BOOL) {
            logger.error("提交的约束不是 Bool: {} : {}", constraint, constraint.getSort());
            throw new SortMismatchException("约束必须是 Bool，实际为 " + constraint.getSort() + ": " + constraint);
        }
        return constraint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstraintSet that = (ConstraintSet) o;
        return constraints.equals(that.constraints);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (constraints.isEmpty()) {
            return "TRUE";
        }
        return constraints.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(" /\\ ", "(", ")"));
    }
}
