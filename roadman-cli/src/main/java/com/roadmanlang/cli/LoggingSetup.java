package com.roadmanlang.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging 初始化：读取 classpath 上的 roadman-logging.properties
 */
final class LoggingSetup {

    static final String CONFIG_RESOURCE = "/roadman-logging.properties";

    private static final String[] ROOT_LOGGERS = {"com.roadmanlang", "roadman"};

    /** 保持强引用，避免 Logger 被回收后级别丢失 */
    private static final Logger[] ROOTS = new Logger[ROOT_LOGGERS.length];

    private static boolean loaded;

    private LoggingSetup() {
    }

    static synchronized void configure(boolean verbose) {
        if (!loaded) {
            loadConfig();
            loaded = true;
        }
        if (verbose) {
            for (int i = 0; i < ROOT_LOGGERS.length; i++) {
                ROOTS[i] = Logger.getLogger(ROOT_LOGGERS[i]);
                ROOTS[i].setLevel(Level.FINE);
            }
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }
    }

    private static void loadConfig() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            Logger.getLogger(LoggingSetup.class.getName())
                    .log(Level.WARNING, "Cannot read " + CONFIG_RESOURCE, e);
        }
    }
}
