package com.roadmanlang.compiler.ast.decl;

import com.roadmanlang.compiler.ast.AstNode;
import com.roadmanlang.compiler.ast.AstVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
