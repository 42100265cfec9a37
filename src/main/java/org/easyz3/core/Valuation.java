package org.easyz3.core;

import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.exceptions.UndeclaredSymbolException;
import org.easyz3.expressions.Expression;
import org.easyz3.expressions.ExpressionEvaluator;
import org.easyz3.expressions.Ref;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一次 SAT 求解得到的模型：每个已声明符号到具体值的映射。
 * Int 为 {@link BigInteger}，Real 为 {@link Rational}，Bool 为 {@link Boolean}，函数为 {@link FunctionTable}。
 * 模型要么完整构造，要么不构造；构造后不可变。
 */
public final class Valuation {

    private static final Logger logger = LoggerFactory.getLogger(Valuation.class);

    private final Map<Declaration, Object> values;
    private final Map<String, Declaration> byName;

    private Valuation(Map<Declaration, Object> values) {
        Map<Declaration, Object> copy = new LinkedHashMap<>();
        Map<String, Declaration> names = new LinkedHashMap<>();
        values.forEach((declaration, value) -> {
            copy.put(declaration, normalize(declaration, value));
            names.put(declaration.getName(), declaration);
        });
        this.values = Collections.unmodifiableMap(copy);
        this.byName = Collections.unmodifiableMap(names);
        logger.debug("创建 Valuation: {}", this);
    }

    /**
     * 工厂方法：从声明到值的映射创建 Valuation，值会按声明的 sort 规范化。
     * @throws SortMismatchException 值与声明的 sort 不兼容。
     */
    public static Valuation of(Map<Declaration, Object> values) {
        return new Valuation(values);
    }

    private static Object normalize(Declaration declaration, Object value) {
        Objects.requireNonNull(value, "符号 '" + declaration.getName() + "' 的值不能为 null");
        if (declaration.isFunction()) {
            if (!(value instanceof FunctionTable table) || !table.getFunction().equals(declaration)) {
                logger.error("函数符号 '{}' 的值不是对应的函数表: {}", declaration.getName(), value);
                throw new SortMismatchException("函数符号 '" + declaration.getName() + "' 的值必须是它的 FunctionTable");
            }
            return table;
        }
        return declaration.getSort().coerceValue(value);
    }

    /**
     * 获取符号的值。
     * @throws UndeclaredSymbolException 此模型不包含该声明（未在产生此模型的会话中声明）。
     */
    public Object get(Declaration declaration) {
        Object value = values.get(declaration);
        if (value == null) {
            logger.error("尝试获取不存在的符号值：符号 '{}' 不存在于当前模型 {} 中。", declaration.getName(), this);
            throw new UndeclaredSymbolException("符号 '" + declaration.getName() + "' 不在此模型的会话中声明");
        }
        return value;
    }

    public Object get(Ref ref) {
        return get(ref.getDeclaration());
    }

    public Object get(String name) {
        Declaration declaration = byName.get(name);
        if (declaration == null) {
            logger.error("尝试获取不存在的符号值：名称 '{}'", name);
            throw new UndeclaredSymbolException("符号 '" + name + "' 不在此模型的会话中声明");
        }
        return values.get(declaration);
    }

    public BigInteger getInt(Ref ref) {
        return typed(ref, SortKind.INT, BigInteger.class);
    }

    public Rational getReal(Ref ref) {
        return typed(ref, SortKind.REAL, Rational.class);
    }

    public boolean getBool(Ref ref) {
        return typed(ref, SortKind.BOOL, Boolean.class);
    }

    public FunctionTable getFunction(Ref ref) {
        return getFunction(ref.getDeclaration());
    }

    public FunctionTable getFunction(Declaration declaration) {
        Object value = get(declaration);
        if (!(value instanceof FunctionTable table)) {
            logger.error("符号 '{}' 不是函数，sort 为 {}", declaration.getName(), declaration.getSort());
            throw new SortMismatchException("符号 '" + declaration.getName() + "' 的 sort 是 "
                    + declaration.getSort() + "，不是函数");
        }
        return table;
    }

    private <T> T typed(Ref ref, SortKind expected, Class<T> type) {
        Declaration declaration = ref.getDeclaration();
        Object value = get(declaration);
        if (declaration.getSort().getKind() != expected) {
            logger.error("符号 '{}' 的 sort 是 {}，不是 {}", declaration.getName(), declaration.getSort(), expected);
            throw new SortMismatchException("符号 '" + declaration.getName() + "' 的 sort 是 "
                    + declaration.getSort() + "，不是 " + expected.getSymbol());
        }
        return type.cast(value);
    }

    /**
     * 在此模型下精确地求表达式的值。
     * @throws ArithmeticException 表达式中出现除以 0，无法在本地确定其值。
     */
    public Object evaluate(Expression expression) {
        return new ExpressionEvaluator(this).evaluate(expression);
    }

    /**
     * 检查 Bool 表达式在此模型下是否为真。
     * @throws SortMismatchException 表达式不是 Bool。
     */
    public boolean satisfies(Expression expression) {
        if (expression.getSort() != Sort.BOOL) {
            logger.error("satisfies 需要 Bool 表达式，实际为 {}: {}", expression.getSort(), expression);
            throw new SortMismatchException("只能检查 Bool 表达式，实际为 " + expression.getSort());
        }
        return (Boolean) evaluate(expression);
    }

    public boolean contains(Declaration declaration) {
        return values.containsKey(declaration);
    }

    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((Valuation) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey().getName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
