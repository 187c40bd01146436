package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.lexer.Token;
import com.roadmanlang.compiler.lexer.TokenType;

/**
 * 解析异常，中止当前编译单元的解析
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String reason;

    public ParseException(String reason, Token token) {
        super(reason);
        this.token = token;
        this.reason = reason;
    }

    public Token getToken() {
        return token;
    }

    /** 不带位置前缀的错误原因，如 "Expect expression." */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /**
     * 格式：{@code [line L:C] Error at 'x': reason}，输入结尾处为 {@code Error at end}
     */
    @Override
    public String getMessage() {
        if (token == null) {
            return "Error: " + reason;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[line ").append(token.getLine()).append(':').append(token.getColumn()).append("] Error");
        if (token.getType() == TokenType.EOF) {
            sb.append(" at end");
        } else {
            sb.append(" at '").append(token.getLexeme()).append('\'');
        }
        sb.append(": ").append(reason);
        return sb.toString();
    }
}
