package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.expr.Expression;

/**
 * returnz 语句
 */
public class ReturnStmt extends Statement {
    private final Expression value;  // 可选

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
