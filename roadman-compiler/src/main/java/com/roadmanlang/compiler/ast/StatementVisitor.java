package com.roadmanlang.compiler.ast;

import com.roadmanlang.compiler.ast.decl.*;
import com.roadmanlang.compiler.ast.stmt.*;

/**
 * 语句访问者
 *
 * <p>每种语句节点一个方法，没有默认实现。</p>
 *
 * @param <R> 返回类型
 * @param <C> 遍历上下文
 */
public interface StatementVisitor<R, C> {

    // ============ 声明 ============

    R visitVarDecl(VarDecl node, C ctx);

    R visitFunDecl(FunDecl node, C ctx);

    // ============ 语句 ============

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitBlock(Block node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);
}
