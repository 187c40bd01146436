package com.roadmanlang.compiler.ast.expr;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
