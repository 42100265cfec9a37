package org.easyz3.expressions;

/**
 * 表达式树的访问者，每种节点一个方法。
 * @param <R> 访问结果类型。
 */
public interface ExpressionVisitor<R> {
    R visit(Literal literal);
    R visit(Ref ref);
    R visit(UnaryOp unaryOp);
    R visit(BinaryOp binaryOp);
    R visit(Compare compare);
    R visit(BoolOp boolOp);
    R visit(Implies implies);
    R visit(Call call);
}
