package org.easyz3.expressions;

import org.easyz3.core.Declaration;
import org.easyz3.core.Sort;
import org.easyz3.core.SortKind;
import org.easyz3.exceptions.InvalidArityException;
import org.easyz3.exceptions.InvalidOperandException;
import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 表达式的构造函数集合。
 * <p>
 * 所有方法都是纯函数：返回新的不可变节点，不登记任何约束。
 * 操作数可以是 {@link Expression}，也可以是 Java 值（Boolean、整数类型、浮点类型、BigDecimal、{@link Rational}），
 * 后者先经过 {@link #literal(Object)} 转为字面量。
 * sort 检查在构造时完成，失败时立即抛出异常。
 */
public final class Expressions {

    private static final Logger logger = LoggerFactory.getLogger(Expressions.class);

    public static final int MAX_POWER_EXPONENT = 1024;

    public static final Literal TRUE = new Literal(Boolean.TRUE, Sort.BOOL);
    public static final Literal FALSE = new Literal(Boolean.FALSE, Sort.BOOL);

    private Expressions() {
    }

    // --- 叶子 ---

    /**
     * 由 Java 值推断 sort 构造字面量：
     * Boolean 为 Bool；Byte/Short/Integer/Long/BigInteger 为 Int；Float/Double/BigDecimal/Rational 为 Real。
     * @throws InvalidOperandException 不支持的 Java 类型，或非有限的浮点数。
     */
    public static Literal literal(Object value) {
        if (value == null) {
            logger.error("尝试用 null 构造字面量");
            throw new InvalidOperandException("字面量不能为 null");
        }
        if (value instanceof Boolean b) {
            return b ? TRUE : FALSE;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new Literal(BigInteger.valueOf(((Number) value).longValue()), Sort.INT);
        }
        if (value instanceof BigInteger bi) {
            return new Literal(bi, Sort.INT);
        }
        if (value instanceof Rational r) {
            return new Literal(r, Sort.REAL);
        }
        if (value instanceof BigDecimal bd) {
            return new Literal(Rational.valueOf(bd), Sort.REAL);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                logger.error("非有限浮点数不能作为字面量: {}", d);
                throw new InvalidOperandException("非有限浮点数不能作为 Real 字面量: " + d);
            }
            return new Literal(Rational.valueOf(d), Sort.REAL);
        }
        logger.error("无法将 {} 类型的值 {} 转换为字面量", value.getClass().getName(), value);
        throw new InvalidOperandException("不支持的字面量类型: " + value.getClass().getName());
    }

    public static Literal intLiteral(long value) {
        return new Literal(BigInteger.valueOf(value), Sort.INT);
    }

    public static Literal realLiteral(long numerator, long denominator) {
        return new Literal(Rational.valueOf(numerator, denominator), Sort.REAL);
    }

    public static Ref ref(Declaration declaration) {
        return new Ref(Objects.requireNonNull(declaration, "declaration 不能为 null"));
    }

    // --- 一元运算 ---

    public static Expression negate(Object operand) {
        Expression e = requireNumeric(lift(operand), "-");
        return new UnaryOp(UnaryOpType.NEG, e, e.getSort());
    }

    public static Expression plus(Object operand) {
        Expression e = requireNumeric(lift(operand), "+");
        return new UnaryOp(UnaryOpType.POS, e, e.getSort());
    }

    public static Expression not(Object operand) {
        Expression e = requireBool(lift(operand), "not");
        return new UnaryOp(UnaryOpType.NOT, e, Sort.BOOL);
    }

    // --- 二元算术 ---

    public static Expression add(Object left, Object right) {
        return arithmetic(ArithOpType.ADD, left, right);
    }

    public static Expression subtract(Object left, Object right) {
        return arithmetic(ArithOpType.SUB, left, right);
    }

    public static Expression multiply(Object left, Object right) {
        return arithmetic(ArithOpType.MUL, left, right);
    }

    /**
     * 除法。两个操作数都是 Int 时为整数除法（SMT-LIB div，结果为 Int），
     * 否则为实数除法，两个操作数都提升为 Real。
     */
    public static Expression divide(Object left, Object right) {
        Expression l = requireNumeric(lift(left), ArithOpType.DIV.getSymbol());
        Expression r = requireNumeric(lift(right), ArithOpType.DIV.getSymbol());
        if (l.getSort() == Sort.INT && r.getSort() == Sort.INT) {
            return new BinaryOp(ArithOpType.INT_DIV, l, r, Sort.INT);
        }
        return new BinaryOp(ArithOpType.DIV, l, r, Sort.REAL);
    }

    /**
     * 整数除法（SMT-LIB div），两个操作数都必须是 Int。
     */
    public static Expression intDivide(Object left, Object right) {
        return integerOnly(ArithOpType.INT_DIV, left, right);
    }

    /**
     * 取模（SMT-LIB mod，结果非负），两个操作数都必须是 Int。
     */
    public static Expression mod(Object left, Object right) {
        return integerOnly(ArithOpType.MOD, left, right);
    }

    /**
     * 幂运算，指数必须是不超过 {@value #MAX_POWER_EXPONENT} 的非负整数字面量（Java 整数或 Int 字面量）。
     * @throws InvalidOperandException 指数不是非负整数字面量，或超过上限。
     */
    public static Expression power(Object base, Object exponent) {
        Expression b = requireNumeric(lift(base), ArithOpType.POW.getSymbol());
        Literal e = requireExponent(exponent);
        return new BinaryOp(ArithOpType.POW, b, e, b.getSort());
    }

    // --- 比较 ---

    public static Expression eq(Object left, Object right) {
        return compare(RelationType.EQ, left, right);
    }

    public static Expression ne(Object left, Object right) {
        return compare(RelationType.NE, left, right);
    }

    public static Expression lt(Object left, Object right) {
        return compare(RelationType.LT, left, right);
    }

    public static Expression le(Object left, Object right) {
        return compare(RelationType.LE, left, right);
    }

    public static Expression gt(Object left, Object right) {
        return compare(RelationType.GT, left, right);
    }

    public static Expression ge(Object left, Object right) {
        return compare(RelationType.GE, left, right);
    }

    /**
     * EQ/NE 接受两个 Bool 或两个数值操作数，其余关系只接受数值操作数。
     */
    public static Expression compare(RelationType relation, Object left, Object right) {
        Expression l = lift(left);
        Expression r = lift(right);
        if (relation.isEquality() && l.getSort() == Sort.BOOL && r.getSort() == Sort.BOOL) {
            return new Compare(relation, l, r, Sort.BOOL);
        }
        Sort unified = Sort.unifyNumeric(l.getSort(), r.getSort());
        if (unified == null) {
            throw mismatch("无法比较 " + l.getSort() + " 和 " + r.getSort() + ": " + l + " " + relation.getSymbol() + " " + r);
        }
        return new Compare(relation, l, r, unified);
    }

    // --- 布尔连接词 ---

    public static Expression and(Object first, Object second, Object... rest) {
        return connective(BoolOpType.AND, first, second, rest);
    }

    public static Expression or(Object first, Object second, Object... rest) {
        return connective(BoolOpType.OR, first, second, rest);
    }

    public static Expression xor(Object left, Object right) {
        return connective(BoolOpType.XOR, left, right);
    }

    /**
     * 对一组约束取合取。
     * @throws InvalidArityException 少于两个操作数。
     */
    public static Expression and(List<?> operands) {
        return connective(BoolOpType.AND, operands);
    }

    public static Expression or(List<?> operands) {
        return connective(BoolOpType.OR, operands);
    }

    public static Expression implies(Object antecedent, Object consequent) {
        Expression a = requireBool(lift(antecedent), "=>");
        Expression c = requireBool(lift(consequent), "=>");
        return new Implies(a, c);
    }

    /**
     * 反向蕴含：{@code consequent <= antecedent}，即 {@code antecedent => consequent}。
     */
    public static Expression impliedBy(Object consequent, Object antecedent) {
        return implies(antecedent, consequent);
    }

    // --- 函数调用 ---

    /**
     * 构造函数调用。Int 参数可以传给 Real 形参。
     * @throws SortMismatchException 被调用者不是函数，或参数 sort 不匹配。
     * @throws InvalidArityException 参数个数与定义域长度不符。
     */
    public static Expression call(Ref function, Object... arguments) {
        Objects.requireNonNull(function, "function 不能为 null");
        Declaration declaration = function.getDeclaration();
        Sort sort = declaration.getSort();
        if (!sort.isFunction()) {
            throw mismatch("'" + declaration.getName() + "' 的 sort 是 " + sort + "，不能作为函数调用");
        }
        if (arguments.length != sort.getArity()) {
            logger.error("函数 '{}' 需要 {} 个参数，实际传入 {} 个", declaration.getName(), sort.getArity(), arguments.length);
            throw new InvalidArityException("函数 '" + declaration.getName() + "' 需要 " + sort.getArity()
                    + " 个参数，实际为 " + arguments.length);
        }
        List<Expression> args = new ArrayList<>(arguments.length);
        for (int i = 0; i < arguments.length; i++) {
            Expression arg = lift(arguments[i]);
            Sort expected = sort.getDomain().get(i);
            if (!expected.accepts(arg.getSort())) {
                throw mismatch("函数 '" + declaration.getName() + "' 的第 " + (i + 1) + " 个参数应为 "
                        + expected + "，实际为 " + arg.getSort() + ": " + arg);
            }
            args.add(arg);
        }
        return new Call(declaration, args);
    }

    // --- 内部辅助 ---

    static Expression lift(Object operand) {
        if (operand instanceof Expression e) {
            return e;
        }
        return literal(operand);
    }

    private static Expression arithmetic(ArithOpType op, Object left, Object right) {
        Expression l = requireNumeric(lift(left), op.getSymbol());
        Expression r = requireNumeric(lift(right), op.getSymbol());
        return new BinaryOp(op, l, r, Sort.unifyNumeric(l.getSort(), r.getSort()));
    }

    private static Expression integerOnly(ArithOpType op, Object left, Object right) {
        Expression l = lift(left);
        Expression r = lift(right);
        if (l.getSort() != Sort.INT || r.getSort() != Sort.INT) {
            throw mismatch("运算 " + op.getSymbol() + " 只接受 Int 操作数，实际为 " + l.getSort() + " 和 " + r.getSort());
        }
        return new BinaryOp(op, l, r, Sort.INT);
    }

    private static Expression connective(BoolOpType op, Object first, Object second, Object... rest) {
        List<Object> operands = new ArrayList<>(2 + rest.length);
        operands.add(first);
        operands.add(second);
        operands.addAll(List.of(rest));
        return connective(op, operands);
    }

    private static Expression connective(BoolOpType op, List<?> operands) {
        if (operands.size() < 2 || (op == BoolOpType.XOR && operands.size() != 2)) {
            logger.error("{} 的操作数个数非法: {}", op, operands.size());
            throw new InvalidArityException(op + " 需要" + (op == BoolOpType.XOR ? "恰好" : "至少") + " 2 个操作数，实际为 " + operands.size());
        }
        List<Expression> lifted = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            lifted.add(requireBool(lift(operand), op.getSymbol()));
        }
        return new BoolOp(op, lifted);
    }

    private static Literal requireExponent(Object exponent) {
        Object value = exponent;
        if (exponent instanceof Literal literal) {
            value = literal.getValue();
        } else if (exponent instanceof Expression) {
            logger.error("幂运算的指数不是字面量: {}", exponent);
            throw new InvalidOperandException("幂运算的指数必须是非负整数字面量，实际为表达式 " + exponent);
        }
        Expression lifted = lift(value);
        if (lifted.getSort() != Sort.INT || ((BigInteger) ((Literal) lifted).getValue()).signum() < 0) {
            logger.error("幂运算的指数不是非负整数: {}", exponent);
            throw new InvalidOperandException("幂运算的指数必须是非负整数字面量，实际为 " + exponent);
        }
        if (((BigInteger) ((Literal) lifted).getValue()).compareTo(BigInteger.valueOf(MAX_POWER_EXPONENT)) > 0) {
            logger.error("幂运算的指数 {} 超过上限 {}", exponent, MAX_POWER_EXPONENT);
            throw new InvalidOperandException("幂运算的指数不能超过 " + MAX_POWER_EXPONENT + "，实际为 " + exponent);
        }
        return (Literal) lifted;
    }

    private static Expression requireNumeric(Expression e, String op) {
        if (!e.getSort().isNumeric()) {
            throw mismatch("运算 " + op + " 需要 Int 或 Real 操作数，实际为 " + e.getSort() + ": " + e);
        }
        return e;
    }

    private static Expression requireBool(Expression e, String op) {
        if (e.getSort().getKind() != SortKind.BOOL) {
            throw mismatch("运算 " + op + " 需要 Bool 操作数，实际为 " + e.getSort() + ": " + e);
        }
        return e;
    }

    private static SortMismatchException mismatch(String message) {
        logger.error(message);
        return new SortMismatchException(message);
    }
}
