package com.roadmanlang.compiler.transpiler;

/**
 * 转译上下文，跟踪输出缓冲区和缩进层级
 */
public class TranspilerContext {
    private final StringBuilder output = new StringBuilder();
    private final TranspileConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public TranspilerContext(TranspileConfig config) {
        this.config = config;
    }

    public TranspileConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
