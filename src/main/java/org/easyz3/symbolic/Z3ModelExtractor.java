package org.easyz3.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.RatNum;
import org.easyz3.core.Declaration;
import org.easyz3.core.FunctionTable;
import org.easyz3.core.Sort;
import org.easyz3.core.Valuation;
import org.easyz3.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 Z3 的模型转换为 {@link Valuation}。
 * 标量用模型补全求值（未约束的符号得到默认值）；函数读取 FuncInterp 的条目和 else 值，
 * 模型中没有出现的函数得到一个只有默认 else 值的表。
 * 无理代数数按配置的小数位数取下界近似。
 */
public class Z3ModelExtractor {

    private static final Logger logger = LoggerFactory.getLogger(Z3ModelExtractor.class);

    private final Z3VariableManager varManager;
    private final int algebraicPrecision;

    public Z3ModelExtractor(Z3VariableManager varManager, int algebraicPrecision) {
        this.varManager = varManager;
        this.algebraicPrecision = algebraicPrecision;
    }

    /**
     * 读取所有已知声明的值。任何一个值无法转换时整体失败，不会产生部分模型。
     * @throws IllegalStateException Z3 返回了无法识别的值。
     */
    public Valuation extract(Model model) {
        Map<Declaration, Object> values = new LinkedHashMap<>();
        for (Declaration declaration : varManager.getAllKnownDeclarations()) {
            if (declaration.isFunction()) {
                values.put(declaration, extractFunction(model, declaration));
            } else {
                Expr value = model.eval(varManager.getZ3Const(declaration), true);
                values.put(declaration, toValue(value, declaration.getSort()));
            }
        }
        Valuation valuation = Valuation.of(values);
        logger.debug("提取模型: {}", valuation);
        return valuation;
    }

    private FunctionTable extractFunction(Model model, Declaration declaration) {
        Sort sort = declaration.getSort();
        FuncDecl funcDecl = varManager.getZ3Function(declaration);
        FuncInterp interp = model.getFuncInterp(funcDecl);
        if (interp == null) {
            logger.debug("函数 {} 不在模型中，使用默认 else 值", declaration.getName());
            return FunctionTable.constant(declaration, sort.getRange().defaultValue());
        }

        Map<List<Object>, Object> entries = new LinkedHashMap<>();
        for (FuncInterp.Entry entry : interp.getEntries()) {
            Expr[] args = entry.getArgs();
            List<Object> key = new ArrayList<>(args.length);
            for (int i = 0; i < args.length; i++) {
                key.add(toValue(args[i], sort.getDomain().get(i)));
            }
            // 同一参数元组只保留第一条，与 Z3 的匹配顺序一致
            entries.putIfAbsent(key, toValue(entry.getValue(), sort.getRange()));
        }

        Expr elseExpr = interp.getElse();
        Object elseValue;
        if (elseExpr != null && isValue(elseExpr)) {
            elseValue = toValue(elseExpr, sort.getRange());
        } else {
            logger.warn("函数 {} 的 else 分支不是常量 ({})，使用默认值", declaration.getName(), elseExpr);
            elseValue = sort.getRange().defaultValue();
        }
        return new FunctionTable(declaration, entries, elseValue);
    }

    private static boolean isValue(Expr expr) {
        return expr.isIntNum() || expr.isRatNum() || expr.isAlgebraicNumber() || expr.isTrue() || expr.isFalse();
    }

    /**
     * 把 Z3 的常量值转换为对应 sort 的 Java 值。
     */
    private Object toValue(Expr expr, Sort sort) {
        switch (sort.getKind()) {
            case BOOL:
                if (expr.isTrue()) {
                    return Boolean.TRUE;
                }
                if (expr.isFalse()) {
                    return Boolean.FALSE;
                }
                break;
            case INT:
                if (expr instanceof IntNum intNum) {
                    return intNum.getBigInteger();
                }
                break;
            case REAL:
                if (expr instanceof RatNum ratNum) {
                    return Rational.fromZ3(ratNum);
                }
                if (expr instanceof IntNum intNum) {
                    return Rational.valueOf(intNum.getBigInteger());
                }
                if (expr.isAlgebraicNumber()) {
                    RatNum lower = ((AlgebraicNum) expr).toLower(algebraicPrecision);
                    logger.warn("Real 值 {} 是无理代数数，近似为 {}", expr, lower);
                    return Rational.fromZ3(lower);
                }
                break;
            default:
                break;
        }
        logger.error("无法把 Z3 值 {} 转换为 {}", expr, sort);
        throw new IllegalStateException("Z3 返回了无法识别的 " + sort + " 值: " + expr);
    }
}
