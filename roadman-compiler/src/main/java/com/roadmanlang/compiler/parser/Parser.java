package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.decl.Program;
import com.roadmanlang.compiler.ast.stmt.Statement;
import com.roadmanlang.compiler.lexer.Lexer;
import com.roadmanlang.compiler.lexer.Token;
import com.roadmanlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.roadmanlang.compiler.lexer.TokenType.*;

/**
 * Roadman 语法分析器（递归下降）
 */
public class Parser {

    private final List<Token> tokens;
    final String fileName;
    private int position = 0;
    Token current;
    Token previous;

    // 当前所在 loopz 的嵌套层数，函数体内重新从 0 开始
    int loopDepth = 0;

    // === Helper 实例 ===
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.current = tokens.get(0);
    }

    public Parser(List<Token> tokens) {
        this(tokens, "<input>");
    }

    /**
     * 从源码直接构建解析器（忽略词法诊断）
     */
    public static Parser fromSource(String source, String fileName) {
        return new Parser(new Lexer(source).scanTokens(), fileName);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (!isAtEnd()) {
            position++;
            current = tokens.get(position);
        }
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序，遇到第一个语法错误即抛出 {@link ParseException}
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            try {
                statements.add(declParser.parseDeclaration());
            } catch (StackOverflowError e) {
                throw nestingTooDeep();
            }
        }
        return new Program(loc, statements);
    }

    /**
     * 容错解析：遇到错误时跳过到下一个语句边界继续解析。
     * 返回的 ParseResult 包含已成功解析的语句和收集到的错误列表。
     */
    public ParseResult parseTolerant() {
        SourceLocation loc = location();
        List<ParseError> errors = new ArrayList<ParseError>();
        List<Statement> statements = new ArrayList<Statement>();

        while (!isAtEnd()) {
            try {
                statements.add(declParser.parseDeclaration());
            } catch (ParseException e) {
                errors.add(ParseError.from(e));
                synchronize();
            } catch (StackOverflowError e) {
                errors.add(ParseError.from(nestingTooDeep()));
                synchronize();
            }
        }

        return new ParseResult(new Program(loc, statements), errors);
    }

    /**
     * 递归下降栈溢出时报告的错误，位置为溢出时的当前 token
     */
    private ParseException nestingTooDeep() {
        return new ParseException("Expression nesting too deep.", current);
    }

    /**
     * 错误恢复：跳过 token，直到刚消费了 ';' 或遇到语句起始关键词
     */
    private void synchronize() {
        advance(); // 跳过触发错误的 token
        while (!isAtEnd()) {
            if (previous.getType() == SEMICOLON) return;
            if (checkAny(KW_FAM, KW_INNIT, KW_LOOPZ, KW_RETURNZ, KW_GIMME, KW_CONSTE, KW_STOPIT)) {
                return;
            }
            advance();
        }
    }
}
