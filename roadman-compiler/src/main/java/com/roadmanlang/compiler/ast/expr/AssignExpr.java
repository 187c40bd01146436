package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * 赋值表达式，目标只能是变量名
 */
public class AssignExpr extends Expression {
    private final String name;
    private final Expression value;

    public AssignExpr(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
