package com.roadmanlang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * REPL 测试（使用回退循环，不依赖终端）
 */
class ReplRunnerTest {

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private ReplRunner repl;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        repl = new ReplRunner(
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8),
                1000);
    }

    private void feed(String input) {
        repl.runFallbackLoop(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    @DisplayName("状态在多行输入之间保留")
    void testStatePersists() {
        feed("gimme x = 10;\nsay(x * 2);\n");
        assertThat(out()).contains("20.0\n");
    }

    @Test
    @DisplayName("出错后继续读取下一行")
    void testContinuesAfterErrors() {
        feed("gimme x = 1;\nsay(x / 0);\nsay(nope);\ngimme = 2;\nsay(x + 1);\n");
        assertThat(err())
                .contains("Division by zero.")
                .contains("Undefined variable 'nope'.")
                .contains("Expect variable name.");
        assertThat(out()).contains("2.0\n");
    }

    @Test
    @DisplayName("未闭合的括号进入多行模式")
    void testMultiline() {
        feed("fam greet(name) {\n  say(\"yo \" + name);\n}\ngreet(\"fam\");\n");
        assertThat(out()).contains(ReplRunner.CONTINUATION_PROMPT).contains("yo fam\n");
        assertThat(err()).isEmpty();
    }

    @Test
    @DisplayName("反斜杠续行")
    void testBackslashContinuation() {
        feed("say(1 +\\\n2);\n");
        assertThat(out()).contains("3.0\n");
    }

    @Test
    @DisplayName("exit() 与 :quit 退出")
    void testExit() {
        feed("say(1);\nexit()\nsay(2);\n");
        assertThat(out()).contains("1.0\n").doesNotContain("2.0");

        outBuffer.reset();
        feed(":q\nsay(3);\n");
        assertThat(out()).doesNotContain("3.0");
    }

    @Test
    @DisplayName(":reset 清空环境")
    void testReset() {
        feed("gimme kept = 1;\n:reset\nsay(kept);\n");
        assertThat(out()).contains("环境已重置");
        assertThat(err()).contains("Undefined variable 'kept'.");
    }

    @Test
    @DisplayName(":env 列出全局变量")
    void testEnv() {
        feed("conste answer = 42;\n:env\n");
        assertThat(out()).contains("conste answer = 42.0");
    }

    @Test
    @DisplayName("未知命令")
    void testUnknownCommand() {
        feed(":bogus\n");
        assertThat(out()).contains("未知命令: :bogus");
    }

    @Test
    @DisplayName("注释中的括号不触发多行模式")
    void testBracketsInComments() {
        assertThat(repl.handleLine("say(1); // note (see below")).isTrue();
        assertThat(repl.handleLine("say(2); /* [ { */")).isTrue();
        assertThat(repl.handleLine("say(3);")).isTrue();
        assertThat(out()).isEqualTo("1.0\n2.0\n3.0\n");
    }

    @Test
    @DisplayName("括号计数忽略字符串与注释内容")
    void testHasUnclosedBrackets() {
        assertThat(ReplRunner.hasUnclosedBrackets("fam f() {")).isTrue();
        assertThat(ReplRunner.hasUnclosedBrackets("say([1, 2")).isTrue();
        assertThat(ReplRunner.hasUnclosedBrackets("say(\"{\");")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("{ }")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("say(1); // (\n")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("/* ( */ fam f() {")).isTrue();
        assertThat(ReplRunner.hasUnclosedBrackets("say(1); /* still open (")).isFalse();
    }
}
