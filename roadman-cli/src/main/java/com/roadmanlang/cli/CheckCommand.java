package com.roadmanlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：容错解析，列出全部词法与语法错误
 */
@Command(name = "check", description = "检查源码文件的词法与语法错误（不执行）")
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--json", description = "以 JSON 输出")
    boolean json;

    @Override
    public Integer call() {
        parent.configureLogging();
        return new CompileRunner(parent.out, parent.err).checkFile(file, json);
    }
}
