package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofNumber(SourceLocation location, double value) {
        return new Literal(location, value, LiteralKind.NUMBER);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public static Literal ofBoolean(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOLEAN);
    }

    /** NUMBER 为 Double，STRING 为 String，BOOLEAN 为 Boolean */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN
    }
}
