package com.roadmanlang.compiler.transpiler;

import com.roadmanlang.compiler.ast.decl.Program;
import com.roadmanlang.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * JavaScript 转译测试
 */
class JsTranspilerTest {

    private final JsTranspiler transpiler = new JsTranspiler();

    private Program parse(String source) {
        return Parser.fromSource(source, "<test>").parse();
    }

    private String js(String source) {
        return transpiler.transpile(parse(source));
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("gimme 转 let，conste 转 const")
        void testVarDecls() {
            assertThat(js("gimme x = 10;")).isEqualTo("let x = 10.0;");
            assertThat(js("conste y = \"hi\";")).isEqualTo("const y = \"hi\";");
            assertThat(js("gimme z;")).isEqualTo("let z;");
        }

        @Test
        @DisplayName("函数声明")
        void testFunDecl() {
            assertThat(js("fam add(a, b) { returnz a + b; }"))
                    .isEqualTo("function add(a, b) {\n  return a + b;\n}");
            assertThat(js("fam f() { returnz; }"))
                    .isEqualTo("function f() {\n  return;\n}");
        }

        @Test
        @DisplayName("语句之间以换行分隔")
        void testProgramSeparator() {
            assertThat(js("gimme a = 1;\nsay(a);")).isEqualTo("let a = 1.0;\nconsole.log(a);");
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("innit / elseway")
        void testIfElse() {
            assertThat(js("innit (x > 1) { say(x); } elseway { say(0); }"))
                    .isEqualTo("if (x > 1.0) {\n  console.log(x);\n} else {\n  console.log(0.0);\n}");
        }

        @Test
        @DisplayName("非块分支")
        void testBareBranches() {
            assertThat(js("innit (a) say(1); elseway say(2);"))
                    .isEqualTo("if (a) console.log(1.0); else console.log(2.0);");
        }

        @Test
        @DisplayName("loopz 与 stopit")
        void testWhileBreak() {
            assertThat(js("loopz (true) { stopit; }")).isEqualTo("while (true) {\n  break;\n}");
        }

        @Test
        @DisplayName("嵌套块逐层缩进")
        void testNestedIndent() {
            assertThat(js("fam f() { loopz (true) { stopit; } }"))
                    .isEqualTo("function f() {\n  while (true) {\n    break;\n  }\n}");
        }

        @Test
        @DisplayName("空块")
        void testEmptyBlock() {
            assertThat(js("{}")).isEqualTo("{}");
            assertThat(js("fam noop() {}")).isEqualTo("function noop() {}");
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("say 转 console.log")
        void testSay() {
            assertThat(js("say(1 + 2 * 3);")).isEqualTo("console.log(1.0 + 2.0 * 3.0);");
        }

        @Test
        @DisplayName("只有分组节点输出括号")
        void testGrouping() {
            assertThat(js("say((1 + 2) * 3);")).isEqualTo("console.log((1.0 + 2.0) * 3.0);");
            assertThat(js("x = a - (b - c);")).isEqualTo("x = a - (b - c);");
        }

        @Test
        @DisplayName("逻辑运算符")
        void testLogical() {
            assertThat(js("say(a && b || !c);")).isEqualTo("console.log(a && b || !c);");
        }

        @Test
        @DisplayName("双重取负不变成自减")
        void testDoubleNegation() {
            assertThat(js("say(- -x);")).isEqualTo("console.log(- -x);");
            assertThat(js("say(-!x);")).isEqualTo("console.log(-!x);");
        }

        @Test
        @DisplayName("列表、赋值与链式调用")
        void testListAssignCall() {
            assertThat(js("say([1, \"two\", true]);")).isEqualTo("console.log([1.0, \"two\", true]);");
            assertThat(js("x = y = 3;")).isEqualTo("x = y = 3.0;");
            assertThat(js("f(1)(2);")).isEqualTo("f(1.0)(2.0);");
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscaping() {
            assertThat(js("say(\"a\nb\");")).isEqualTo("console.log(\"a\\nb\");");
            assertThat(js("say(\"C:\\dir\");")).isEqualTo("console.log(\"C:\\\\dir\");");
        }

        @Test
        @DisplayName("len 与 clock 内置映射")
        void testBuiltins() {
            assertThat(js("say(len(xs));")).isEqualTo("console.log(xs.length);");
            assertThat(js("say(len(\"abc\"));")).isEqualTo("console.log(\"abc\".length);");
            assertThat(js("len(a + b);")).isEqualTo("(a + b).length;");
            assertThat(js("gimme t = clock();")).isEqualTo("let t = (Date.now() / 1000);");
            assertThat(js("len(a, b);")).isEqualTo("len(a, b);");
        }
    }

    @Nested
    @DisplayName("配置与完整性")
    class ConfigTests {

        @Test
        @DisplayName("自定义缩进")
        void testCustomIndent() {
            TranspileConfig config = new TranspileConfig();
            config.setIndentSize(4);
            assertThat(transpiler.transpile(parse("{ say(1); }"), config)).isEqualTo("{\n    console.log(1.0);\n}");

            config.setUseSpaces(false);
            assertThat(transpiler.transpile(parse("{ say(1); }"), config)).isEqualTo("{\n\tconsole.log(1.0);\n}");
        }

        @Test
        @DisplayName("解析得到的任意程序都能转译")
        void testTotal() {
            String source = "conste limit = 3;\n"
                    + "fam counter() { gimme c = 0; fam inc() { c = c + 1; returnz c; } returnz inc; }\n"
                    + "gimme i = 0;\n"
                    + "loopz (i < limit) { innit (i % 2 == 0 && !false) say(i); elseway { stopit; } i = i + 1; }\n"
                    + "say([counter()(), len(\"x\"), clock() >= 0, -(1), \"back\\slash\"]);";
            assertThatCode(() -> js(source)).doesNotThrowAnyException();
            assertThat(js(source)).contains("function counter()").contains("while (i < limit)");
        }
    }
}
