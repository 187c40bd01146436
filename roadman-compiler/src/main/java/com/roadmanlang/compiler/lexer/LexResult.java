package com.roadmanlang.compiler.lexer;

import java.util.List;

/**
 * 词法分析结果：Token 序列（以 EOF 结尾）与诊断列表
 */
public final class LexResult {
    private final List<Token> tokens;
    private final List<LexDiagnostic> diagnostics;

    public LexResult(List<Token> tokens, List<LexDiagnostic> diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<LexDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
