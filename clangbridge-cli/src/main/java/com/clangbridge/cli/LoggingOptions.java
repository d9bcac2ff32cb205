package com.clangbridge.cli;

import picocli.CommandLine.Option;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 各子命令共用的日志选项（picocli mixin）
 */
public class LoggingOptions {

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志到 stderr")
    boolean verbose;

    public void apply() {
        configure(verbose ? Level.FINE : Level.WARNING);
    }

    /**
     * 日志统一写到 stderr，不干扰 stdout 上的声明输出
     */
    static void configure(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
        Logger.getLogger("com.clangbridge").setLevel(level);
    }
}
