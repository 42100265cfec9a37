package org.easyz3.expressions;

import org.easyz3.core.Declaration;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 收集表达式树中引用到的所有声明（包括被调用的函数），按首次出现的顺序。
 * 共享的子树只访问一次。
 */
public class DeclarationCollector implements ExpressionVisitor<Void> {

    private final Set<Declaration> declarations = new LinkedHashSet<>();
    private final Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    public static Set<Declaration> collect(Expression expression) {
        DeclarationCollector collector = new DeclarationCollector();
        collector.visitChild(expression);
        return Collections.unmodifiableSet(collector.declarations);
    }

    private Void visitChild(Expression expression) {
        if (visited.add(expression)) {
            expression.accept(this);
        }
        return null;
    }

    @Override
    public Void visit(Literal literal) {
        return null;
    }

    @Override
    public Void visit(Ref ref) {
        declarations.add(ref.getDeclaration());
        return null;
    }

    @Override
    public Void visit(UnaryOp unaryOp) {
        return visitChild(unaryOp.getOperand());
    }

    @Override
    public Void visit(BinaryOp binaryOp) {
        visitChild(binaryOp.getLeft());
        return visitChild(binaryOp.getRight());
    }

    @Override
    public Void visit(Compare compare) {
        visitChild(compare.getLeft());
        return visitChild(compare.getRight());
    }

    @Override
    public Void visit(BoolOp boolOp) {
        boolOp.getOperands().forEach(this::visitChild);
        return null;
    }

    @Override
    public Void visit(Implies implies) {
        visitChild(implies.getAntecedent());
        return visitChild(implies.getConsequent());
    }

    @Override
    public Void visit(Call call) {
        declarations.add(call.getFunction());
        call.getArguments().forEach(this::visitChild);
        return null;
    }
}
