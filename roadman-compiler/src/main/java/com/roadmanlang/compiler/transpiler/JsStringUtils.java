package com.roadmanlang.compiler.transpiler;

/**
 * JavaScript 字面量输出工具
 */
public final class JsStringUtils {

    private JsStringUtils() {
    }

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 双引号包裹并转义 */
    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    /** 数字与解释器的显示规则一致：总带小数部分，如 10.0 */
    public static String formatNumber(double value) {
        return Double.toString(value);
    }
}
