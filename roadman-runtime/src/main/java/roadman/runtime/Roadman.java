package roadman.runtime;

import com.roadmanlang.compiler.ast.decl.Program;
import com.roadmanlang.compiler.lexer.LexDiagnostic;
import com.roadmanlang.compiler.lexer.LexResult;
import com.roadmanlang.compiler.lexer.Lexer;
import com.roadmanlang.compiler.parser.ParseException;
import com.roadmanlang.compiler.parser.Parser;
import roadman.runtime.interpreter.Interpreter;
import roadman.runtime.interpreter.RoadmanRuntimeException;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Roadman 便捷 API：词法、语法、执行一条龙。
 *
 * <p>同一实例多次调用共享全局状态（交互模式依赖这一点）：</p>
 * <pre>
 * Roadman roadman = new Roadman();
 * roadman.run("gimme x = 10;");
 * roadman.run("say(x * 2);");   // 20.0
 * </pre>
 *
 * <p>错误写入错误流，不向外抛出；结果见 {@link RunResult}。非线程安全。</p>
 */
public final class Roadman {

    private static final Logger LOG = Logger.getLogger(Roadman.class.getName());

    private final Interpreter interpreter;
    private final PrintStream err;

    public Roadman() {
        this(System.out, System.err);
    }

    public Roadman(PrintStream out, PrintStream err) {
        this.interpreter = new Interpreter(out, err);
        this.err = err;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public Roadman setMaxCallDepth(int maxCallDepth) {
        interpreter.setMaxCallDepth(maxCallDepth);
        return this;
    }

    // ── 变量操作 ──────────────────────────────────────────

    /**
     * 在全局环境定义可变变量（Java 值自动转换）
     */
    public Roadman set(String name, Object value) {
        interpreter.getGlobals().defineVar(name, RoadmanValue.fromJava(value));
        return this;
    }

    /**
     * 读取全局变量，不存在时返回 null
     */
    public RoadmanValue get(String name) {
        return interpreter.getGlobals().tryGet(name);
    }

    // ── 执行 ─────────────────────────────────────────────

    public RunResult run(String source) {
        return run(source, "<input>");
    }

    /**
     * 执行一段源码。词法错误时不解析，语法错误时不执行，运行时错误中止剩余语句。
     */
    public RunResult run(String source, String fileName) {
        LexResult lexed = new Lexer(source).tokenize();
        if (lexed.hasErrors()) {
            List<String> messages = new ArrayList<>();
            for (LexDiagnostic diagnostic : lexed.getDiagnostics()) {
                messages.add(diagnostic.toString());
                err.println(diagnostic);
            }
            LOG.fine(() -> fileName + ": " + messages.size() + " lex error(s)");
            return RunResult.syntaxError(messages);
        }

        Program program;
        try {
            program = new Parser(lexed.getTokens(), fileName).parse();
        } catch (ParseException e) {
            LOG.log(Level.FINE, "Parse failed: " + fileName, e);
            err.println(e.getMessage());
            List<String> messages = new ArrayList<>();
            messages.add(e.getMessage());
            return RunResult.syntaxError(messages);
        }

        try {
            interpreter.execute(program);
            return RunResult.success();
        } catch (RoadmanRuntimeException e) {
            LOG.log(Level.FINE, "Runtime error in " + fileName, e);
            err.println(e.format());
            return RunResult.runtimeError(e.format());
        }
    }
}
