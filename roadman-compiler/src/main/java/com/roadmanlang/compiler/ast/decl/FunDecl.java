package com.roadmanlang.compiler.ast.decl;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.stmt.Block;
import com.roadmanlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明（fam）
 */
public class FunDecl extends Statement {
    private final String name;
    private final List<String> params;
    private final Block body;

    public FunDecl(SourceLocation location, String name, List<String> params, Block body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
