package org.easyz3.symbolic;

import org.easyz3.core.DeclarationRegistry;
import org.easyz3.expressions.ConstraintSet;

/**
 * 求解引擎的边界。实现只读取声明和约束，不修改它们，也不在两次调用之间保留状态。
 */
public interface SolverBackend {

    /**
     * 对给定声明和约束求解。
     * UNSAT 和 UNKNOWN 通过返回值表达，不抛异常。
     */
    SolveResult solve(DeclarationRegistry registry, ConstraintSet constraints, SolverOptions options);

    /**
     * 把求解输入渲染为 SMT-LIB2 文本，用于诊断。
     */
    String toSmtLib(DeclarationRegistry registry, ConstraintSet constraints);
}
