package com.roadmanlang.compiler.ast;

/**
 * AST 节点基类。解析完成后节点不可变。
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
