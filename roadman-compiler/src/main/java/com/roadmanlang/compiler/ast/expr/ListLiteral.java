package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 列表字面量
 */
public class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitListLiteral(this, context);
    }
}
