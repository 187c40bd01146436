package com.roadmanlang.compiler.ast.stmt;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
