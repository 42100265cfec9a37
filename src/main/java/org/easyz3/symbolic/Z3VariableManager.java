package org.easyz3.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.easyz3.core.Declaration;
import org.easyz3.exceptions.UndeclaredSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理 Declaration 到 Z3 符号的映射：标量声明对应 Z3 常量，函数声明对应 Z3 FuncDecl。
 * 构造时为所有已知声明创建 Z3 符号，保证每个声明在一个 Z3 Context 中只有一个对应符号。
 * 实例绑定到单个 Context，不做同步。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final Map<Declaration, Expr> constants;
    private final Map<Declaration, FuncDecl> functions;

    // 按声明顺序保存，供模型提取使用
    private final List<Declaration> allKnownDeclarations;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param declarations 会话中的全部声明。
     */
    public Z3VariableManager(Context ctx, Collection<Declaration> declarations) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.allKnownDeclarations = Collections.unmodifiableList(new ArrayList<>(declarations));
        this.constants = new LinkedHashMap<>();
        this.functions = new LinkedHashMap<>();

        for (Declaration declaration : allKnownDeclarations) {
            if (declaration.isFunction()) {
                Sort[] domain = declaration.getSort().getDomain().stream()
                        .map(this::toZ3Sort)
                        .toArray(Sort[]::new);
                FuncDecl funcDecl = ctx.mkFuncDecl(declaration.getName(), domain, toZ3Sort(declaration.getSort().getRange()));
                functions.put(declaration, funcDecl);
                logger.debug("创建 Z3 函数符号: {} : {}", declaration.getName(), declaration.getSort());
            } else {
                constants.put(declaration, ctx.mkConst(declaration.getName(), toZ3Sort(declaration.getSort())));
                logger.debug("创建 Z3 常量: {} : {}", declaration.getName(), declaration.getSort());
            }
        }

        logger.debug("Z3VariableManager 初始化完成，管理 {} 个常量，{} 个函数。", constants.size(), functions.size());
    }

    /**
     * 标量 sort 到 Z3 Sort 的映射。
     */
    public Sort toZ3Sort(org.easyz3.core.Sort sort) {
        return switch (sort.getKind()) {
            case INT -> ctx.getIntSort();
            case REAL -> ctx.getRealSort();
            case BOOL -> ctx.getBoolSort();
            case FUNC -> throw new IllegalArgumentException("函数 sort 没有对应的 Z3 标量 sort: " + sort);
        };
    }

    /**
     * 获取标量声明对应的 Z3 常量。
     * @throws UndeclaredSymbolException 声明不在此管理器中。
     */
    public Expr getZ3Const(Declaration declaration) {
        Expr constant = constants.get(declaration);
        if (constant == null) {
            logger.error("声明 '{}' 没有对应的 Z3 常量", declaration.getName());
            throw new UndeclaredSymbolException("符号 '" + declaration.getName() + "' 未在此会话中声明");
        }
        return constant;
    }

    /**
     * 获取函数声明对应的 Z3 FuncDecl。
     * @throws UndeclaredSymbolException 声明不在此管理器中。
     */
    public FuncDecl getZ3Function(Declaration declaration) {
        FuncDecl function = functions.get(declaration);
        if (function == null) {
            logger.error("声明 '{}' 没有对应的 Z3 函数", declaration.getName());
            throw new UndeclaredSymbolException("函数 '" + declaration.getName() + "' 未在此会话中声明");
        }
        return function;
    }
}
