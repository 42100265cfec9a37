package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Declaration;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 未解释函数的调用，结果 sort 为函数的值域。
 */
@Getter
public final class Call extends Expression {

    private final Declaration function;
    private final List<Expression> arguments;

    private final int hashCode;

    Call(Declaration function, List<Expression> arguments) {
        super(function.getSort().getRange());
        this.function = function;
        this.arguments = List.copyOf(arguments);
        this.hashCode = Objects.hash(function, this.arguments);
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
        Call call = (Call) o;
        return function.equals(call.function) && arguments.equals(call.arguments);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return function.getName() + arguments.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
