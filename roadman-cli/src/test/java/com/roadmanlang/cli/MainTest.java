package com.roadmanlang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 命令行入口测试
 */
class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
    }

    private int execute(String... args) {
        Main main = new Main(
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
        return new CommandLine(main).execute(args);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    private Path script(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("命令名")
    void testCommandName() {
        assertThat(new CommandLine(new Main()).getCommandName()).isEqualTo("roadman");
    }

    @Nested
    @DisplayName("执行脚本")
    class RunTests {

        @Test
        @DisplayName("运行文件")
        void testRunFile() throws IOException {
            Path file = script("fact.rm", "fam factorial(n) {\n"
                    + "  innit (n < 2) { returnz 1; }\n"
                    + "  returnz n * factorial(n - 1);\n"
                    + "}\n"
                    + "say(factorial(5));\n");
            assertThat(execute(file.toString())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo("120.0\n");
        }

        @Test
        @DisplayName("-e 执行代码片段")
        void testExpression() {
            assertThat(execute("-e", "say(10 * (4 - 2) + 5 / 2);")).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo("22.5\n");
        }

        @Test
        @DisplayName("语法错误退出码 65")
        void testSyntaxErrorExit() {
            assertThat(execute("-e", "gimme x = ;")).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(err()).contains("[line 1:11] Error at ';': Expect expression.");
        }

        @Test
        @DisplayName("词法错误退出码 65")
        void testLexErrorExit() {
            assertThat(execute("-e", "say(1 | 2);")).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(err()).contains("Did you mean '||'?");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("嵌套过深退出码 65")
        void testDeepNestingExit() {
            String deep = "say(" + "(".repeat(20000) + "1" + ")".repeat(20000) + ");";
            assertThat(execute("-e", deep)).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(err()).contains("Expression nesting too deep.");
        }

        @Test
        @DisplayName("运行时错误退出码 70")
        void testRuntimeErrorExit() {
            assertThat(execute("-e", "say(\"a\"); say(1 / 0);")).isEqualTo(Main.EXIT_RUNTIME_ERROR);
            assertThat(out()).isEqualTo("a\n");
            assertThat(err()).contains("Runtime error: Division by zero.");
        }

        @Test
        @DisplayName("文件不存在退出码 1")
        void testMissingFile() {
            assertThat(execute(tempDir.resolve("missing.rm").toString())).isEqualTo(Main.EXIT_IO_ERROR);
            assertThat(err()).contains("missing.rm");
        }

        @Test
        @DisplayName("--max-call-depth 限制递归")
        void testMaxCallDepth() {
            int code = execute("--max-call-depth", "20", "-e", "fam f(n) { returnz f(n + 1); } f(0);");
            assertThat(code).isEqualTo(Main.EXIT_RUNTIME_ERROR);
            assertThat(err()).contains("Maximum recursion depth exceeded (20)");
        }

        @Test
        @DisplayName("--max-call-depth 必须为正数")
        void testInvalidMaxCallDepth() {
            assertThat(execute("--max-call-depth", "0", "-e", "say(1);")).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(out()).isEmpty();
        }
    }

    @Nested
    @DisplayName("transpile 子命令")
    class TranspileTests {

        @Test
        @DisplayName("打印到标准输出")
        void testTranspileToStdout() throws IOException {
            Path file = script("add.rm", "fam add(a, b) { returnz a + b; }\nsay(add(1, 2));");
            assertThat(execute("transpile", file.toString())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo("function add(a, b) {\n  return a + b;\n}\nconsole.log(add(1.0, 2.0));\n");
        }

        @Test
        @DisplayName("写入文件并使用 Tab 缩进")
        void testTranspileToFile() throws IOException {
            Path file = script("loop.rm", "loopz (true) { stopit; }");
            Path target = tempDir.resolve("out/loop.js");
            assertThat(execute("transpile", file.toString(), "-o", target.toString(), "--use-tabs"))
                    .isEqualTo(Main.EXIT_OK);
            String js = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
            assertThat(js).isEqualTo("while (true) {\n\tbreak;\n}\n");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("负的缩进宽度是用法错误")
        void testNegativeIndentSize() throws IOException {
            Path file = script("ok.rm", "say(1);");
            assertThat(execute("transpile", "--indent-size", "-1", file.toString()))
                    .isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(err()).contains("--indent-size");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("语法错误不输出代码")
        void testTranspileSyntaxError() throws IOException {
            Path file = script("bad.rm", "stopit;");
            assertThat(execute("transpile", file.toString())).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(err()).contains("Cannot use 'stopit' outside of a loop.");
            assertThat(out()).isEmpty();
        }
    }

    @Nested
    @DisplayName("tokens 子命令")
    class TokensTests {

        @Test
        @DisplayName("文本输出")
        void testPlain() throws IOException {
            Path file = script("t.rm", "gimme x = 1;");
            assertThat(execute("tokens", file.toString())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo("1:1\tKW_GIMME\tgimme\n"
                    + "1:7\tIDENTIFIER\tx\n"
                    + "1:9\tASSIGN\t=\n"
                    + "1:11\tNUMBER_LITERAL\t1\n"
                    + "1:12\tSEMICOLON\t;\n"
                    + "1:13\tEOF\n");
        }

        @Test
        @DisplayName("JSON 输出包含诊断")
        void testJson() throws IOException {
            Path file = script("t.rm", "say(\"hi\") & 1;");
            assertThat(execute("tokens", "--json", file.toString())).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(out())
                    .contains("\"type\": \"STRING_LITERAL\"")
                    .contains("\"literal\": \"hi\"")
                    .contains("\"type\": \"EOF\"")
                    .contains("\"message\": \"Unexpected character: &. Did you mean '&&'?\"");
        }
    }

    @Nested
    @DisplayName("check 子命令")
    class CheckTests {

        @Test
        @DisplayName("无错误")
        void testClean() throws IOException {
            Path file = script("ok.rm", "gimme x = 1; say(x);");
            assertThat(execute("check", file.toString())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).endsWith("ok.rm: OK\n");
        }

        @Test
        @DisplayName("列出全部错误")
        void testAllErrors() throws IOException {
            Path file = script("bad.rm", "gimme x = ;\ngimme y = 2;\nsay(y;\n");
            assertThat(execute("check", file.toString())).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(out())
                    .contains("[line 1:11] Error at ';': Expect expression.")
                    .contains("Expect ')' after arguments.")
                    .contains("2 error(s)");
        }

        @Test
        @DisplayName("JSON 输出")
        void testJson() throws IOException {
            Path file = script("bad.rm", "innit (x { }");
            assertThat(execute("check", "--json", file.toString())).isEqualTo(Main.EXIT_SYNTAX_ERROR);
            assertThat(out()).contains("\"ok\": false").contains("\"parseErrors\"");
        }
    }
}
