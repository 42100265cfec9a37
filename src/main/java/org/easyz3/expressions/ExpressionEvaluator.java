package org.easyz3.expressions;

import org.easyz3.core.Sort;
import org.easyz3.core.Valuation;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在给定模型下对表达式树做精确求值。
 * Int 用 BigInteger、Real 用 Rational 计算，INT_DIV/MOD 采用 SMT-LIB 的欧几里得语义（余数非负）。
 * 同一个子树实例只求值一次。
 */
public class ExpressionEvaluator implements ExpressionVisitor<Object> {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final Valuation valuation;
    private final Map<Expression, Object> cache = new IdentityHashMap<>();

    public ExpressionEvaluator(Valuation valuation) {
        this.valuation = valuation;
    }

    /**
     * 对表达式求值，命中缓存时直接返回之前的结果。
     */
    public Object evaluate(Expression expression) {
        Object cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        Object value = expression.accept(this);
        cache.put(expression, value);
        return value;
    }

    @Override
    public Object visit(Literal literal) {
        return literal.getValue();
    }

    @Override
    public Object visit(Ref ref) {
        return valuation.get(ref.getDeclaration());
    }

    @Override
    public Object visit(UnaryOp unaryOp) {
        Object operand = evaluate(unaryOp.getOperand());
        return switch (unaryOp.getOp()) {
            case NEG -> operand instanceof BigInteger i ? i.negate() : ((Rational) operand).negate();
            case POS -> operand;
            case NOT -> !(Boolean) operand;
        };
    }

    @Override
    public Object visit(BinaryOp binaryOp) {
        Object left = evaluate(binaryOp.getLeft());
        Object right = evaluate(binaryOp.getRight());
        if (binaryOp.getSort() == Sort.INT) {
            return evaluateInt(binaryOp.getOp(), (BigInteger) left, (BigInteger) right);
        }
        return evaluateReal(binaryOp.getOp(), toRational(left), toRational(right));
    }

    private static BigInteger evaluateInt(ArithOpType op, BigInteger left, BigInteger right) {
        return switch (op) {
            case ADD -> left.add(right);
            case SUB -> left.subtract(right);
            case MUL -> left.multiply(right);
            case POW -> left.pow(right.intValueExact());
            case INT_DIV -> left.subtract(euclideanMod(left, right)).divide(right);
            case MOD -> euclideanMod(left, right);
            case DIV -> throw new IllegalStateException("DIV 的结果 sort 恒为 Real");
        };
    }

    private static Rational evaluateReal(ArithOpType op, Rational left, Rational right) {
        return switch (op) {
            case ADD -> left.add(right);
            case SUB -> left.subtract(right);
            case MUL -> left.multiply(right);
            case DIV -> left.divide(right);
            case POW -> left.pow(right.toBigIntegerExact().intValueExact());
            case INT_DIV, MOD -> throw new IllegalStateException(op + " 的结果 sort 恒为 Int");
        };
    }

    /**
     * SMT-LIB 的 mod：结果在 [0, |divisor|) 内。
     */
    private static BigInteger euclideanMod(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0) {
            logger.error("无法在本地对除数为 0 的整数除法求值: {} / 0", dividend);
            throw new ArithmeticException("整数除法的除数为 0，其值由求解器任意解释");
        }
        return dividend.mod(divisor.abs());
    }

    @Override
    public Object visit(Compare compare) {
        Object left = evaluate(compare.getLeft());
        Object right = evaluate(compare.getRight());
        if (compare.getOperandSort() == Sort.BOOL) {
            boolean equal = left.equals(right);
            return compare.getRelation() == RelationType.EQ ? equal : !equal;
        }
        return compare.getRelation().holds(toRational(left).compareTo(toRational(right)));
    }

    @Override
    public Object visit(BoolOp boolOp) {
        List<Expression> operands = boolOp.getOperands();
        return switch (boolOp.getOp()) {
            case AND -> operands.stream().allMatch(e -> (Boolean) evaluate(e));
            case OR -> operands.stream().anyMatch(e -> (Boolean) evaluate(e));
            case XOR -> (Boolean) evaluate(operands.get(0)) ^ (Boolean) evaluate(operands.get(1));
        };
    }

    @Override
    public Object visit(Implies implies) {
        boolean antecedent = (Boolean) evaluate(implies.getAntecedent());
        return !antecedent || (Boolean) evaluate(implies.getConsequent());
    }

    @Override
    public Object visit(Call call) {
        Object[] arguments = call.getArguments().stream().map(this::evaluate).toArray();
        return valuation.getFunction(call.getFunction()).apply(arguments);
    }

    private static Rational toRational(Object value) {
        if (value instanceof BigInteger i) {
            return Rational.valueOf(i);
        }
        return (Rational) value;
    }
}
