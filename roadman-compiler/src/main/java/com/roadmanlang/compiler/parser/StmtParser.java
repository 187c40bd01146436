package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.expr.Expression;
import com.roadmanlang.compiler.ast.stmt.*;
import com.roadmanlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.roadmanlang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        if (parser.check(KW_INNIT)) {
            return parseIfStmt();
        }
        if (parser.check(KW_LOOPZ)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_RETURNZ)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_STOPIT)) {
            return parseBreakStmt();
        }
        return parseExpressionStmt();
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expect '{' before block.");

        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parser.declParser.parseDeclaration());
        }

        parser.expect(RBRACE, "Expect '}' after block.");
        return new Block(loc, statements);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // innit
        parser.expect(LPAREN, "Expect '(' after 'innit'.");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expect ')' after if condition.");

        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSEWAY)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // loopz
        parser.expect(LPAREN, "Expect '(' after 'loopz'.");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expect ')' after loop condition.");

        parser.loopDepth++;
        try {
            Statement body = parseStatement();
            return new WhileStmt(loc, condition, body);
        } finally {
            parser.loopDepth--;
        }
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // returnz

        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expect ';' after return value.");
        return new ReturnStmt(loc, value);
    }

    private BreakStmt parseBreakStmt() {
        SourceLocation loc = parser.location();
        Token keyword = parser.advance(); // stopit
        if (parser.loopDepth == 0) {
            throw new ParseException("Cannot use 'stopit' outside of a loop.", keyword);
        }
        parser.expect(SEMICOLON, "Expect ';' after 'stopit'.");
        return new BreakStmt(loc);
    }

    private ExpressionStmt parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expect ';' after expression.");
        return new ExpressionStmt(loc, expr);
    }
}
