package com.roadmanlang.compiler.transpiler;

/**
 * JavaScript 输出配置
 */
public class TranspileConfig {
    private int indentSize = 2;
    private boolean useSpaces = true;

    public TranspileConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
