package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.expr.*;
import com.roadmanlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.roadmanlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级由低到高：赋值、||、&amp;&amp;、相等、比较、加减、乘除模、一元、调用、基本表达式。
 * 二元层级均为左结合。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignExpr();
    }

    // 赋值（右结合），目标必须是裸变量
    private Expression parseAssignExpr() {
        Expression expr = parseDisjunctionExpr();

        if (parser.match(ASSIGN)) {
            Token equals = parser.previous;
            Expression value = parseAssignExpr();
            if (expr instanceof Variable) {
                return new AssignExpr(expr.getLocation(), ((Variable) expr).getName(), value);
            }
            throw new ParseException("Invalid assignment target.", equals);
        }

        return expr;
    }

    // 逻辑或 ||
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 &&
    private Expression parseConjunctionExpr() {
        Expression left = parseEqualityExpr();

        while (parser.match(AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseEqualityExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 相等 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.matchAny(EQ, NE)) {
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp op = parser.previous.is(EQ) ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(loc, left, op, right);
        }

        return left;
    }

    // 比较 < <= > >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.matchAny(LT, LE, GT, GE)) {
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp op;
            switch (parser.previous.getType()) {
                case LT: op = BinaryExpr.BinaryOp.LT; break;
                case LE: op = BinaryExpr.BinaryOp.LE; break;
                case GT: op = BinaryExpr.BinaryOp.GT; break;
                default: op = BinaryExpr.BinaryOp.GE; break;
            }
            Expression right = parseAdditiveExpr();
            left = new BinaryExpr(loc, left, op, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.matchAny(PLUS, MINUS)) {
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp op = parser.previous.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(loc, left, op, right);
        }

        return left;
    }

    // 乘除模 * / %（除零检查在运行时）
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrefixExpr();

        while (parser.matchAny(MUL, DIV, MOD)) {
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp op;
            switch (parser.previous.getType()) {
                case MUL: op = BinaryExpr.BinaryOp.MUL; break;
                case DIV: op = BinaryExpr.BinaryOp.DIV; break;
                default: op = BinaryExpr.BinaryOp.MOD; break;
            }
            Expression right = parsePrefixExpr();
            left = new BinaryExpr(loc, left, op, right);
        }

        return left;
    }

    // 一元 ! -
    private Expression parsePrefixExpr() {
        if (parser.matchAny(NOT, MINUS)) {
            SourceLocation loc = parser.previousLocation();
            UnaryExpr.UnaryOp op = parser.previous.is(NOT) ? UnaryExpr.UnaryOp.NOT : UnaryExpr.UnaryOp.NEG;
            Expression operand = parsePrefixExpr();
            return new UnaryExpr(loc, op, operand);
        }
        return parseCallExpr();
    }

    // 调用链 f(a)(b)
    private Expression parseCallExpr() {
        Expression expr = parsePrimaryExpr();

        while (parser.match(LPAREN)) {
            SourceLocation loc = parser.previousLocation();
            List<Expression> args = new ArrayList<Expression>();
            if (!parser.check(RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expect ')' after arguments.");
            expr = new CallExpr(loc, expr, args);
        }

        return expr;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();

        if (parser.match(NUMBER_LITERAL)) {
            return Literal.ofNumber(loc, (Double) parser.previous.getLiteral());
        }
        if (parser.match(STRING_LITERAL)) {
            return Literal.ofString(loc, (String) parser.previous.getLiteral());
        }
        if (parser.match(KW_TRUE)) {
            return Literal.ofBoolean(loc, true);
        }
        if (parser.match(KW_FALSE)) {
            return Literal.ofBoolean(loc, false);
        }
        if (parser.match(IDENTIFIER)) {
            return new Variable(loc, parser.previous.getLexeme());
        }
        if (parser.match(LPAREN)) {
            Expression inner = parseExpression();
            parser.expect(RPAREN, "Expect ')' after expression.");
            return new GroupingExpr(loc, inner);
        }
        if (parser.match(LBRACKET)) {
            return parseListLiteral(loc);
        }

        throw new ParseException("Expect expression.", parser.current);
    }

    private Expression parseListLiteral(SourceLocation loc) {
        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACKET)) {
            do {
                elements.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACKET, "Expect ']' after list elements.");
        return new ListLiteral(loc, elements);
    }
}
