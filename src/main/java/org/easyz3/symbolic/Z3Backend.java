package org.easyz3.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.apache.commons.lang3.StringUtils;
import org.easyz3.core.DeclarationRegistry;
import org.easyz3.core.Valuation;
import org.easyz3.expressions.ConstraintSet;
import org.easyz3.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 Z3 的求解后端。
 * 每次调用都新建一个 Context，声明全部符号、按提交顺序断言约束，然后 check 并分类结果。
 * Context 在返回前关闭，没有任何 Z3 对象会泄漏到调用方。
 */
public class Z3Backend implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(Z3Backend.class);

    private static final String UNKNOWN_REASON = "unknown";

    @Override
    public SolveResult solve(DeclarationRegistry registry, ConstraintSet constraints, SolverOptions options) {
        logger.debug("开始求解: {} 个声明, {} 条约束, {}", registry.size(), constraints.size(), options);
        try (Context ctx = new Context(options.getContextParameters())) {
            Z3VariableManager varManager = new Z3VariableManager(ctx, registry.getDeclarations());
            Solver solver = buildSolver(ctx, varManager, constraints);
            if (options.hasTimeout()) {
                Params params = ctx.mkParams();
                params.add("timeout", (int) Math.min(options.getTimeout().toMillis(), Integer.MAX_VALUE));
                solver.setParameters(params);
            }

            Status status;
            try {
                status = solver.check();
            } catch (Z3Exception e) {
                logger.warn("Z3 check 失败: {}", e.getMessage());
                return SolveResult.unknown(normalizeReason(e.getMessage()));
            }

            switch (status) {
                case SATISFIABLE:
                    Valuation model = new Z3ModelExtractor(varManager, options.getAlgebraicPrecision())
                            .extract(solver.getModel());
                    return SolveResult.sat(model);
                case UNSATISFIABLE:
                    return SolveResult.unsat();
                default:
                    String reason = normalizeReason(solver.getReasonUnknown());
                    logger.warn("求解结果 UNKNOWN: {}", reason);
                    return SolveResult.unknown(reason);
            }
        }
    }

    @Override
    public String toSmtLib(DeclarationRegistry registry, ConstraintSet constraints) {
        try (Context ctx = new Context(SolverOptions.builtin().getContextParameters())) {
            Z3VariableManager varManager = new Z3VariableManager(ctx, registry.getDeclarations());
            return buildSolver(ctx, varManager, constraints).toString();
        }
    }

    private static Solver buildSolver(Context ctx, Z3VariableManager varManager, ConstraintSet constraints) {
        Z3TermCompiler compiler = new Z3TermCompiler(ctx, varManager);
        Solver solver = ctx.mkSolver();
        for (Expression constraint : constraints) {
            BoolExpr term = compiler.compileConstraint(constraint);
            solver.add(term);
        }
        logger.debug("已断言 {} 条约束，翻译缓存 {} 项", constraints.size(), compiler.getCacheSize());
        return solver;
    }

    /**
     * 超时和取消统一报告为 {@value SolveResult#TIMEOUT_REASON}。
     */
    static String normalizeReason(String reason) {
        if (StringUtils.isBlank(reason)) {
            return UNKNOWN_REASON;
        }
        if (StringUtils.containsIgnoreCase(reason, "timeout") || StringUtils.containsIgnoreCase(reason, "cancel")) {
            return SolveResult.TIMEOUT_REASON;
        }
        return reason;
    }
}
