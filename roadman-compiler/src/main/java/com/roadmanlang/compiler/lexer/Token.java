package com.roadmanlang.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 字面量的解析值：数字为 Double，字符串为去掉引号的内容，其余为 null */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /** 调试显示，如 {@code IDENTIFIER 'x' @1:7} */
    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
