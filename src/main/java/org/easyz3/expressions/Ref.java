package org.easyz3.expressions;

import lombok.Getter;
import org.easyz3.core.Declaration;

import java.util.Objects;

/**
 * 对已声明符号的引用。函数 sort 的引用只能作为 {@link Call} 的被调用者。
 */
@Getter
public final class Ref extends Expression {

    private final Declaration declaration;

    Ref(Declaration declaration) {
        super(declaration.getSort());
        this.declaration = declaration;
    }

    public String getName() {
        return declaration.getName();
    }

    /**
     * 以此函数引用构造函数调用，等价于 {@link Expressions#call(Ref, Object...)}。
     */
    public Expression call(Object... arguments) {
        return Expressions.call(this, arguments);
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
        return declaration.equals(((Ref) o).declaration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Ref.class, declaration);
    }

    @Override
    public String toString() {
        return declaration.getName();
    }
}
