package com.roadmanlang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Roadman 词法分析器
 *
 * <p>遇到无法识别的字符或未闭合的字符串时不中断，记录 {@link LexDiagnostic} 后继续扫描，
 * 由调用方决定如何报告。源码只扫描一次，重复调用返回同一结果。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexDiagnostic> diagnostics = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 Token 起始位置（字符串可跨行，需单独记录）
    private int startLine = 1;
    private int startColumn = 1;

    private boolean scanned = false;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("gimme", TokenType.KW_GIMME);
        map.put("conste", TokenType.KW_CONSTE);
        map.put("fam", TokenType.KW_FAM);

        // 控制流
        map.put("innit", TokenType.KW_INNIT);
        map.put("elseway", TokenType.KW_ELSEWAY);
        map.put("loopz", TokenType.KW_LOOPZ);
        map.put("stopit", TokenType.KW_STOPIT);
        map.put("returnz", TokenType.KW_RETURNZ);
        map.put("switchup", TokenType.KW_SWITCHUP);
        map.put("casez", TokenType.KW_CASEZ);
        map.put("defend", TokenType.KW_DEFEND);

        // 字面量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        // 类型名
        map.put("digit", TokenType.KW_DIGIT);
        map.put("word", TokenType.KW_WORD);
        map.put("boola", TokenType.KW_BOOLA);
        map.put("listz", TokenType.KW_LISTZ);
        map.put("mapz", TokenType.KW_MAPZ);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 REPL 补全等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * 执行词法分析，返回 Token 列表（总以唯一的 EOF 结尾）
     */
    public List<Token> scanTokens() {
        if (!scanned) {
            while (!isAtEnd()) {
                start = current;
                startLine = line;
                startColumn = column;
                scanToken();
            }
            tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
            scanned = true;
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * 执行词法分析，同时返回诊断信息
     */
    public LexResult tokenize() {
        return new LexResult(scanTokens(), Collections.unmodifiableList(diagnostics));
    }

    public List<LexDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;

            // 可能是多字符的 Token
            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释
                    blockComment();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character: &. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character: |. Did you mean '||'?");
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\n':
                break;

            // 字符串
            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    /** 字符串不处理转义，允许跨行 */
    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            advance();
        }

        if (isAtEnd()) {
            error("Unterminated string.");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, source.substring(start + 1, current - 1));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分：'.' 后必须跟数字，否则 '.' 留给下一个 Token
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
        }

        addToken(TokenType.NUMBER_LITERAL, Double.parseDouble(source.substring(start, current)));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    /** 未闭合的块注释一直吞到输入结尾 */
    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    private void error(String message) {
        diagnostics.add(new LexDiagnostic(message, startLine, startColumn));
    }
}
