package com.roadmanlang.compiler.lexer;

/**
 * 词法诊断：无法识别的字符、未闭合的字符串
 */
public final class LexDiagnostic {
    private final String message;
    private final int line;
    private final int column;

    public LexDiagnostic(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return String.format("[line %d:%d] Lex error: %s", line, column, message);
    }
}
