package com.roadmanlang.compiler.ast;

import com.roadmanlang.compiler.ast.expr.*;

/**
 * 表达式访问者
 *
 * <p>每种表达式节点一个方法，没有默认实现：新增节点时所有后端都必须处理。</p>
 *
 * @param <R> 返回类型
 * @param <C> 遍历上下文
 */
public interface ExpressionVisitor<R, C> {

    R visitLiteral(Literal node, C ctx);

    R visitVariable(Variable node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitGroupingExpr(GroupingExpr node, C ctx);

    R visitAssignExpr(AssignExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitListLiteral(ListLiteral node, C ctx);
}
