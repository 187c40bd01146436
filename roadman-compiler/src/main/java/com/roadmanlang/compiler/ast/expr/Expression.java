package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.AstNode;
import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
