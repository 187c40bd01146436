package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;

/**
 * stopit 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
