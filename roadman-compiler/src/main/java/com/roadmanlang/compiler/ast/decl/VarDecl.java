package com.roadmanlang.compiler.ast.decl;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.expr.Expression;
import com.roadmanlang.compiler.ast.stmt.Statement;

/**
 * 变量声明（gimme / conste）
 */
public class VarDecl extends Statement {
    private final String name;
    private final Expression initializer;  // 可选
    private final boolean isConstant;

    public VarDecl(SourceLocation location, String name, Expression initializer, boolean isConstant) {
        super(location);
        this.name = name;
        this.initializer = initializer;
        this.isConstant = isConstant;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public boolean isConstant() {
        return isConstant;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
