package com.roadmanlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli tokens 子命令：输出词法分析结果
 */
@Command(name = "tokens", description = "输出源码文件的 Token 序列与词法诊断")
public class TokensCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--json", description = "以 JSON 输出")
    boolean json;

    @Override
    public Integer call() {
        parent.configureLogging();
        return new CompileRunner(parent.out, parent.err).dumpTokens(file, json);
    }
}
