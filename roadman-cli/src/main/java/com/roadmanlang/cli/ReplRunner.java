package com.roadmanlang.cli;

import roadman.runtime.Roadman;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 *
 * <p>所有输入共享同一个 {@link Roadman} 实例，出错后状态保留。</p>
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    static final String PROMPT = "roadman> ";
    static final String CONTINUATION_PROMPT = "... ";

    private final PrintStream out;
    private final PrintStream err;
    private final int maxCallDepth;
    private final StringBuilder multilineBuffer = new StringBuilder();
    private Roadman roadman;

    public ReplRunner(PrintStream out, PrintStream err, int maxCallDepth) {
        this.out = out;
        this.err = err;
        this.maxCallDepth = maxCallDepth;
        this.roadman = newSession();
    }

    private Roadman newSession() {
        return new Roadman(out, err).setMaxCallDepth(maxCallDepth);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        out.println("输入 :help 获取帮助，:quit 或 exit() 退出");
        out.println();

        if (System.console() == null) {
            // 标准输入被重定向，不需要行编辑
            runFallbackLoop(System.in);
        } else {
            try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
                LineReader reader = LineReaderBuilder.builder()
                        .terminal(terminal)
                        .parser(new DefaultParser())
                        .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                        .build();
                runLoop(reader);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "终端初始化失败，回退到简单模式", e);
                runFallbackLoop(System.in);
            }
        }

        out.println();
        out.println("再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            String line;
            try {
                line = reader.readLine(currentPrompt());
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
                continue;
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
            if (line == null || !handleLine(line)) break;
        }
    }

    /**
     * 回退循环（无终端时使用 BufferedReader）
     */
    void runFallbackLoop(InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print(currentPrompt());
            out.flush();

            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null || !handleLine(line)) break;
        }
    }

    private String currentPrompt() {
        return multilineBuffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT;
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean handleLine(String line) {
        if (multilineBuffer.length() == 0) {
            String trimmed = line.trim();
            if (trimmed.startsWith(":")) {
                return handleReplCommand(trimmed);
            }
            if ("exit()".equalsIgnoreCase(trimmed)) {
                return false;
            }
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append('\n');
            return true;
        }

        multilineBuffer.append(line).append('\n');
        String source = multilineBuffer.toString();
        // 未闭合括号自动续行
        if (hasUnclosedBrackets(source)) {
            return true;
        }
        multilineBuffer.setLength(0);

        if (!source.trim().isEmpty()) {
            roadman.run(source, "<repl>");
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号（字符串和注释内的括号不计，注释规则同 Lexer）
     */
    static boolean hasUnclosedBrackets(String text) {
        int braces = 0;
        int parens = 0;
        int brackets = 0;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            char next = i + 1 < length ? text.charAt(i + 1) : '\0';

            if (c == '"') {
                int close = text.indexOf('"', i + 1);
                if (close < 0) break;
                i = close;
                continue;
            }
            if (c == '/' && next == '/') {
                int eol = text.indexOf('\n', i);
                if (eol < 0) break;
                i = eol;
                continue;
            }
            if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) break;
                i = end + 1;
                continue;
            }

            switch (c) {
                case '{': braces++; break;
                case '}': braces--; break;
                case '(': parens++; break;
                case ')': parens--; break;
                case '[': brackets++; break;
                case ']': brackets--; break;
                default: break;
            }
        }

        return braces > 0 || parens > 0 || brackets > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":version".equals(command)) {
            out.println("Roadman v" + Main.VERSION);
            out.println("Java: " + System.getProperty("java.version"));
            return true;
        }

        if (":reset".equals(command)) {
            roadman = newSession();
            out.println("环境已重置");
            return true;
        }

        if (":env".equals(command)) {
            out.println(roadman.getInterpreter().getGlobals());
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    private void printBanner() {
        out.println("Roadman v" + Main.VERSION + " REPL");
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL（也可输入 exit()）");
        out.println("  :version         显示版本");
        out.println("  :reset           重置环境");
        out.println("  :env             显示全局变量");
        out.println();
        out.println("示例:");
        out.println("  gimme x = 42;                     定义变量");
        out.println("  conste name = \"fam\";              定义常量");
        out.println("  fam add(a, b) { returnz a + b; }  定义函数");
        out.println("  say(add(x, 1));                   打印结果");
        out.println();
        out.println("提示:");
        out.println("  - 行尾使用 \\ 可以输入多行");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
