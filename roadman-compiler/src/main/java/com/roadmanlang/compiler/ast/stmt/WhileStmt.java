package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.expr.Expression;

/**
 * loopz 循环
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Statement body;

    public WhileStmt(SourceLocation location, Expression condition, Statement body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
