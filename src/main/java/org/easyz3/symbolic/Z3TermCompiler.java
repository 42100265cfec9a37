package org.easyz3.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.easyz3.core.Sort;
import org.easyz3.expressions.BinaryOp;
import org.easyz3.expressions.BoolOp;
import org.easyz3.expressions.Call;
import org.easyz3.expressions.Compare;
import org.easyz3.expressions.Expression;
import org.easyz3.expressions.ExpressionVisitor;
import org.easyz3.expressions.Implies;
import org.easyz3.expressions.Literal;
import org.easyz3.expressions.Ref;
import org.easyz3.expressions.UnaryOp;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把表达式树逐节点翻译为 Z3 项，每种节点一条规则。
 * 翻译结果按节点的结构相等性缓存：同一棵（或结构相同的）子树只翻译一次，得到同一个 Z3 项。
 * 需要提升为 Real 的 Int 子项用 {@code to_real} 包裹。
 * 实例绑定到单个 Context。
 */
public class Z3TermCompiler implements ExpressionVisitor<Expr> {

    private static final Logger logger = LoggerFactory.getLogger(Z3TermCompiler.class);

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final Map<Expression, Expr> cache = new HashMap<>();

    public Z3TermCompiler(Context ctx, Z3VariableManager varManager) {
        this.ctx = ctx;
        this.varManager = varManager;
    }

    /**
     * 翻译一个表达式，命中缓存时直接返回之前的结果。
     */
    public Expr compile(Expression expression) {
        Expr cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        Expr term = expression.accept(this);
        cache.put(expression, term);
        logger.debug("翻译 {} => {}", expression, term);
        return term;
    }

    /**
     * 翻译一个 Bool 约束。
     */
    public BoolExpr compileConstraint(Expression constraint) {
        if (constraint.getSort() != Sort.BOOL) {
            throw new IllegalArgumentException("约束必须是 Bool: " + constraint);
        }
        return (BoolExpr) compile(constraint);
    }

    public int getCacheSize() {
        return cache.size();
    }

    /**
     * 翻译子项，并在需要时把 Int 提升为 Real。
     */
    private Expr compileAs(Expression expression, Sort target) {
        Expr term = compile(expression);
        if (target == Sort.REAL && expression.getSort() == Sort.INT) {
            return ctx.mkInt2Real(term);
        }
        return term;
    }

    @Override
    public Expr visit(Literal literal) {
        return switch (literal.getSort().getKind()) {
            case INT -> ctx.mkInt(((BigInteger) literal.getValue()).toString());
            case REAL -> ((Rational) literal.getValue()).toZ3Real(ctx);
            case BOOL -> ctx.mkBool((Boolean) literal.getValue());
            case FUNC -> throw new IllegalStateException("字面量不能是函数: " + literal);
        };
    }

    @Override
    public Expr visit(Ref ref) {
        if (ref.getDeclaration().isFunction()) {
            throw new IllegalStateException("函数 '" + ref.getName() + "' 只能出现在调用位置");
        }
        return varManager.getZ3Const(ref.getDeclaration());
    }

    @Override
    public Expr visit(UnaryOp unaryOp) {
        Expr operand = compile(unaryOp.getOperand());
        return switch (unaryOp.getOp()) {
            case NEG -> ctx.mkUnaryMinus(operand);
            case POS -> operand;
            case NOT -> ctx.mkNot(operand);
        };
    }

    @Override
    public Expr visit(BinaryOp binaryOp) {
        Sort sort = binaryOp.getSort();
        return switch (binaryOp.getOp()) {
            case ADD -> ctx.mkAdd(compileAs(binaryOp.getLeft(), sort), compileAs(binaryOp.getRight(), sort));
            case SUB -> ctx.mkSub(compileAs(binaryOp.getLeft(), sort), compileAs(binaryOp.getRight(), sort));
            case MUL -> ctx.mkMul(compileAs(binaryOp.getLeft(), sort), compileAs(binaryOp.getRight(), sort));
            case DIV -> ctx.mkDiv(compileAs(binaryOp.getLeft(), Sort.REAL), compileAs(binaryOp.getRight(), Sort.REAL));
            case INT_DIV -> ctx.mkDiv(compile(binaryOp.getLeft()), compile(binaryOp.getRight()));
            case MOD -> ctx.mkMod(compile(binaryOp.getLeft()), compile(binaryOp.getRight()));
            case POW -> power(binaryOp);
        };
    }

    /**
     * 幂展开为连乘；指数为 0 时为底数 sort 的 1。
     */
    private Expr power(BinaryOp binaryOp) {
        int exponent = ((BigInteger) ((Literal) binaryOp.getRight()).getValue()).intValueExact();
        if (exponent == 0) {
            return binaryOp.getSort() == Sort.INT ? ctx.mkInt(1) : ctx.mkReal(1);
        }
        Expr base = compile(binaryOp.getLeft());
        if (exponent == 1) {
            return base;
        }
        Expr[] factors = new Expr[exponent];
        Arrays.fill(factors, base);
        return ctx.mkMul(factors);
    }

    @Override
    public Expr visit(Compare compare) {
        Sort operandSort = compare.getOperandSort();
        Expr left = compileAs(compare.getLeft(), operandSort);
        Expr right = compileAs(compare.getRight(), operandSort);
        return switch (compare.getRelation()) {
            case EQ -> ctx.mkEq(left, right);
            case NE -> ctx.mkNot(ctx.mkEq(left, right));
            case LT -> ctx.mkLt(left, right);
            case LE -> ctx.mkLe(left, right);
            case GT -> ctx.mkGt(left, right);
            case GE -> ctx.mkGe(left, right);
        };
    }

    @Override
    public Expr visit(BoolOp boolOp) {
        List<Expression> operands = boolOp.getOperands();
        Expr[] terms = new Expr[operands.size()];
        for (int i = 0; i < terms.length; i++) {
            terms[i] = compile(operands.get(i));
        }
        return switch (boolOp.getOp()) {
            case AND -> ctx.mkAnd(terms);
            case OR -> ctx.mkOr(terms);
            case XOR -> ctx.mkXor(terms[0], terms[1]);
        };
    }

    @Override
    public Expr visit(Implies implies) {
        return ctx.mkImplies(compile(implies.getAntecedent()), compile(implies.getConsequent()));
    }

    @Override
    public Expr visit(Call call) {
        List<Sort> domain = call.getFunction().getSort().getDomain();
        List<Expression> arguments = call.getArguments();
        Expr[] args = new Expr[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = compileAs(arguments.get(i), domain.get(i));
        }
        return ctx.mkApp(varManager.getZ3Function(call.getFunction()), args);
    }
}
