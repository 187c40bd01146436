package com.roadmanlang.compiler.ast;

import com.roadmanlang.compiler.ast.decl.Program;

/**
 * AST 访问者接口：覆盖全部节点，含程序根节点
 */
public interface AstVisitor<R, C> extends ExpressionVisitor<R, C>, StatementVisitor<R, C> {

    R visitProgram(Program node, C ctx);
}
