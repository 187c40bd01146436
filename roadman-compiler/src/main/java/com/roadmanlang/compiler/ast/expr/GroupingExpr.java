package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * 括号表达式
 */
public class GroupingExpr extends Expression {
    private final Expression expression;

    public GroupingExpr(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitGroupingExpr(this, context);
    }
}
