package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.expr.Expression;

/**
 * innit / elseway 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition,
                  Statement thenBranch, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
