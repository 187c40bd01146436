package com.roadmanlang.cli;

import com.roadmanlang.compiler.transpiler.TranspileConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli transpile 子命令：转译为 JavaScript
 */
@Command(name = "transpile", description = "将源码文件转译为 JavaScript")
public class TranspileCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认打印到标准输出）")
    String output;

    @Option(names = "--indent-size", defaultValue = "2", description = "缩进空格数（默认 2）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Override
    public Integer call() {
        parent.configureLogging();
        if (indentSize < 0) {
            parent.err.println("错误: --indent-size 不能为负数");
            return CommandLine.ExitCode.USAGE;
        }
        TranspileConfig config = new TranspileConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        return new CompileRunner(parent.out, parent.err).transpileFile(file, output, config);
    }
}
