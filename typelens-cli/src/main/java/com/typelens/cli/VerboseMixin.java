package com.typelens.cli;

import picocli.CommandLine.Option;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * --verbose 选项：把 com.typelens 日志输出到 stderr
 */
public class VerboseMixin {

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志到 stderr")
    void setVerbose(boolean verbose) {
        configureLogging(verbose ? Level.FINE : Level.WARNING);
    }

    static void configureLogging(Level level) {
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
        Logger.getLogger("com.typelens").setLevel(level);
    }
}
