package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.AstNode;
import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
