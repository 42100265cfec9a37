package org.easyz3.symbolic;

import org.easyz3.core.Declaration;
import org.easyz3.core.DeclarationRegistry;
import org.easyz3.core.Sort;
import org.easyz3.core.Valuation;
import org.easyz3.exceptions.NoModelAvailableException;
import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.exceptions.UndeclaredSymbolException;
import org.easyz3.expressions.ConstraintSet;
import org.easyz3.expressions.DeclarationCollector;
import org.easyz3.expressions.Expression;
import org.easyz3.expressions.Expressions;
import org.easyz3.expressions.Ref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 一个求解会话：持有声明注册表和已提交的约束，可以反复求解。
 * 两次求解之间可以继续声明符号、添加约束；任何修改都会使上一次的结果失效。
 * 会话不是线程安全的，不同会话之间不共享可变状态。
 */
public class SymbolicSession {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicSession.class);

    private final DeclarationRegistry registry = new DeclarationRegistry();
    private final SolverOptions options;
    private final SolverBackend backend;

    private ConstraintSet constraints = ConstraintSet.EMPTY;
    private SolveResult lastResult;

    public SymbolicSession() {
        this(SolverOptions.defaults());
    }

    public SymbolicSession(SolverOptions options) {
        this(options, new Z3Backend());
    }

    public SymbolicSession(SolverOptions options, SolverBackend backend) {
        this.options = Objects.requireNonNull(options, "options 不能为 null");
        this.backend = Objects.requireNonNull(backend, "backend 不能为 null");
    }

    /**
     * 声明一个符号并返回对它的引用。
     * @throws org.easyz3.exceptions.DuplicateDeclarationException 名称已被声明。
     */
    public Ref declare(String name, Sort sort) {
        Declaration declaration = registry.declare(name, sort);
        lastResult = null;
        return Expressions.ref(declaration);
    }

    public Ref declareInt(String name) {
        return declare(name, Sort.INT);
    }

    public Ref declareReal(String name) {
        return declare(name, Sort.REAL);
    }

    public Ref declareBool(String name) {
        return declare(name, Sort.BOOL);
    }

    public Ref declareFunction(String name, List<Sort> domain, Sort range) {
        return declare(name, Sort.function(domain, range));
    }

    public Ref lookup(String name) {
        return Expressions.ref(registry.lookup(name));
    }

    /**
     * 提交一条约束。
     * @throws SortMismatchException 约束不是 Bool。
     * @throws UndeclaredSymbolException 约束引用了不属于此会话的符号。
     */
    public SymbolicSession add(Expression constraint) {
        Objects.requireNonNull(constraint, "约束不能为 null");
        if (constraint.getSort() != Sort.BOOL) {
            logger.error("第 {} 条约束的 sort 为 {}，不是 Bool", constraints.size() + 1, constraint.getSort());
            throw new SortMismatchException("约束必须是 Bool，实际为 " + constraint.getSort());
        }
        Set<Declaration> referenced = DeclarationCollector.collect(constraint);
        for (Declaration declaration : referenced) {
            if (!registry.contains(declaration)) {
                logger.error("第 {} 条约束引用了不属于此会话的符号 '{}'", constraints.size() + 1, declaration.getName());
                throw new UndeclaredSymbolException("符号 '" + declaration.getName() + "' 未在此会话中声明");
            }
        }
        constraints = constraints.and(constraint);
        lastResult = null;
        logger.info("添加约束 #{}，引用 {} 个符号", constraints.size(), referenced.size());
        logger.debug("约束 #{}: {}", constraints.size(), constraint);
        return this;
    }

    public SymbolicSession addAll(Expression... constraints) {
        for (Expression constraint : constraints) {
            add(constraint);
        }
        return this;
    }

    public ConstraintSet getConstraints() {
        return constraints;
    }

    public List<Declaration> getDeclarations() {
        return registry.getDeclarations();
    }

    public SolverOptions getOptions() {
        return options;
    }

    public SolveResult solve() {
        return solve(options);
    }

    /**
     * 使用给定超时求解，会话自身的配置不变。
     */
    public SolveResult solve(Duration timeout) {
        return solve(options.withTimeout(timeout));
    }

    private SolveResult solve(SolverOptions solveOptions) {
        SolveResult result = backend.solve(registry, constraints, solveOptions);
        lastResult = result;
        logger.info("求解完成: {} 个声明, {} 条约束 => {}", registry.size(), constraints.size(), result.getStatus());
        return result;
    }

    /**
     * 上一次求解的模型。
     * @throws NoModelAvailableException 尚未求解、之后又有修改，或者结果不是 SAT。
     */
    public Valuation getModel() {
        if (lastResult == null) {
            logger.error("会话尚未求解或已被修改，没有可用的模型");
            throw new NoModelAvailableException("会话尚未求解或在上次求解后被修改，没有可用的模型");
        }
        return lastResult.getModel();
    }

    public String toSmtLib() {
        return backend.toSmtLib(registry, constraints);
    }

    @Override
    public String toString() {
        return "SymbolicSession{declarations=" + registry + ", constraints=" + constraints + "}";
    }
}
