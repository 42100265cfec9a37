package org.easyz3.core;

import lombok.Getter;
import org.easyz3.exceptions.InvalidArityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 模型中函数符号的解释：有限个 参数元组 -> 值 的条目，加上一个 else 分支。
 * 参数和值都按 sort 规范化（Int 为 BigInteger，Real 为 Rational，Bool 为 Boolean）。
 * 此类是不可变的。
 */
@Getter
public final class FunctionTable {

    private static final Logger logger = LoggerFactory.getLogger(FunctionTable.class);

    private final Declaration function;
    private final Map<List<Object>, Object> entries;
    private final Object elseValue;

    /**
     * @param function 函数声明。
     * @param entries 参数元组到值的映射，会按定义域和值域规范化。
     * @param elseValue 不在条目中的参数对应的值。
     */
    public FunctionTable(Declaration function, Map<List<Object>, Object> entries, Object elseValue) {
        this.function = Objects.requireNonNull(function, "function 不能为 null");
        Sort sort = function.getSort();
        if (!sort.isFunction()) {
            throw new IllegalArgumentException("'" + function.getName() + "' 不是函数符号");
        }
        Map<List<Object>, Object> normalized = new LinkedHashMap<>();
        entries.forEach((args, value) -> normalized.put(normalizeArguments(args.toArray()), sort.getRange().coerceValue(value)));
        this.entries = Collections.unmodifiableMap(normalized);
        this.elseValue = sort.getRange().coerceValue(elseValue);
    }

    /**
     * 没有条目、只有 else 分支的表。
     */
    public static FunctionTable constant(Declaration function, Object value) {
        return new FunctionTable(function, Collections.emptyMap(), value);
    }

    public int getArity() {
        return function.getSort().getArity();
    }

    /**
     * 在具体参数上求值：有对应条目时返回条目的值，否则返回 else 值。
     * Int 型参数可以用于 Real 形参。
     * @throws InvalidArityException 参数个数不符。
     * @throws org.easyz3.exceptions.SortMismatchException 参数类型不符。
     */
    public Object apply(Object... arguments) {
        List<Object> key = normalizeArguments(arguments);
        Object value = entries.get(key);
        if (value == null) {
            logger.debug("{}{} 不在函数表中，使用 else 值 {}", function.getName(), key, elseValue);
            return elseValue;
        }
        return value;
    }

    private List<Object> normalizeArguments(Object[] arguments) {
        List<Sort> domain = function.getSort().getDomain();
        if (arguments.length != domain.size()) {
            logger.error("函数 '{}' 需要 {} 个参数，实际传入 {} 个", function.getName(), domain.size(), arguments.length);
            throw new InvalidArityException("函数 '" + function.getName() + "' 需要 " + domain.size()
                    + " 个参数，实际为 " + arguments.length);
        }
        List<Object> key = new ArrayList<>(arguments.length);
        for (int i = 0; i < arguments.length; i++) {
            key.add(domain.get(i).coerceValue(arguments[i]));
        }
        return Collections.unmodifiableList(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionTable that = (FunctionTable) o;
        return function.equals(that.function) && entries.equals(that.entries) && elseValue.equals(that.elseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, entries, elseValue);
    }

    @Override
    public String toString() {
        String body = entries.entrySet().stream()
                .map(e -> e.getKey().stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"))
                        + " -> " + e.getValue())
                .collect(Collectors.joining(", "));
        return "[" + (body.isEmpty() ? "" : body + ", ") + "else -> " + elseValue + "]";
    }
}
