package com.roadmanlang.cli;

import roadman.runtime.Roadman;
import roadman.runtime.RunResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本和代码片段执行器
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    private final PrintStream out;
    private final PrintStream err;
    private final int maxCallDepth;

    public ScriptRunner(PrintStream out, PrintStream err, int maxCallDepth) {
        this.out = out;
        this.err = err;
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * 执行脚本文件，返回退出码
     */
    public int runScript(String filePath) {
        String source = readSource(filePath, err);
        if (source == null) {
            return Main.EXIT_IO_ERROR;
        }
        return runSource(source, filePath);
    }

    /**
     * 执行一段源码，返回退出码
     */
    public int runSource(String source, String fileName) {
        Roadman roadman = new Roadman(out, err).setMaxCallDepth(maxCallDepth);
        RunResult result = roadman.run(source, fileName);
        LOG.fine(() -> fileName + " finished: " + result.getStatus());
        return exitCode(result);
    }

    static int exitCode(RunResult result) {
        switch (result.getStatus()) {
            case SUCCESS:
                return Main.EXIT_OK;
            case SYNTAX_ERROR:
                return Main.EXIT_SYNTAX_ERROR;
            default:
                return Main.EXIT_RUNTIME_ERROR;
        }
    }

    /**
     * 以 UTF-8 读取源码文件，失败时报告到错误流并返回 null
     */
    static String readSource(String filePath, PrintStream err) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        if (!Files.isReadable(path)) {
            err.println("错误: 无法读取文件 - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Read failed: " + filePath, e);
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return null;
        }
    }
}
