package org.smpels.mcs.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal analysis-internal logger with integer verbosity levels.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * Output goes through SLF4J so the linter's report on stdout stays clean.
 */
public final class AnalysisLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(AnalysisLogger.class);

    private AnalysisLogger() {}

    /**
     * Sets the logging verbosity level.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a warning message.
     * @param format The SLF4J message pattern.
     * @param args   The pattern arguments.
     */
    public static void warn(String format, Object... args) {
        if (level >= WARN) logger.warn(format, args);
    }

    /**
     * Logs an informational message.
     * @param format The SLF4J message pattern.
     * @param args   The pattern arguments.
     */
    public static void info(String format, Object... args) {
        if (level >= INFO) logger.info(format, args);
    }

    /**
     * Logs a debug message.
     * @param format The SLF4J message pattern.
     * @param args   The pattern arguments.
     */
    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    /**
     * Logs a trace message.
     * @param format The SLF4J message pattern.
     * @param args   The pattern arguments.
     */
    public static void trace(String format, Object... args) {
        if (level >= TRACE) logger.trace(format, args);
    }
}
