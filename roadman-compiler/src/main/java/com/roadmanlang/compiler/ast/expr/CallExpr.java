package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    /** 被调用者是否为给定名字的裸变量 */
    public boolean isCallTo(String name) {
        return callee instanceof Variable && ((Variable) callee).getName().equals(name);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
