package com.roadmanlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Roadman CLI 入口点（picocli）
 *
 * <p>退出码：0 成功，1 文件读写失败，65 词法/语法错误，70 运行时错误。</p>
 */
@Command(name = "roadman", version = "Roadman v" + Main.VERSION,
         mixinStandardHelpOptions = true,
         subcommands = {TranspileCommand.class, TokensCommand.class, CheckCommand.class})
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_SYNTAX_ERROR = 65;
    static final int EXIT_RUNTIME_ERROR = 70;

    @Option(names = "-e", description = "执行一段代码")
    String expression;

    @Option(names = "--max-call-depth", defaultValue = "1000", description = "最大调用深度（默认 1000）")
    int maxCallDepth;

    @Option(names = {"-v", "--verbose"}, description = "输出 FINE 级别日志")
    boolean verbose;

    @Parameters(arity = "0..1", description = "脚本文件")
    String file;

    final PrintStream out;
    final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        configureLogging();
        if (maxCallDepth <= 0) {
            err.println("错误: --max-call-depth 必须为正数");
            return CommandLine.ExitCode.USAGE;
        }

        ScriptRunner runner = new ScriptRunner(out, err, maxCallDepth);
        if (expression != null) {
            return runner.runSource(expression, "<cmdline>");
        }
        if (file != null) {
            return runner.runScript(file);
        }
        new ReplRunner(out, err, maxCallDepth).run();
        return EXIT_OK;
    }

    /**
     * 子命令执行前也需调用，--verbose 写在子命令之前时生效
     */
    void configureLogging() {
        LoggingSetup.configure(verbose);
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        int exitCode = new CommandLine(new Main(out, err)).execute(args);
        System.exit(exitCode);
    }
}
