package org.kestrel.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler-internal logger with integer verbosity levels.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * A message is forwarded to SLF4J only if both the verbosity and the backend level allow it.
 * Callers that build an expensive message check {@link #isEnabled(int)} first.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN = 1;
    /** Log level for informational messages. */
    public static final int INFO = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private static volatile int level = INFO;

    private CompilerLogger() {}

    /**
     * Sets the verbosity. Values outside 0..4 are clamped.
     * @param newLevel The new level.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    /**
     * Checks whether a message of the given level would reach the log.
     * @param messageLevel One of {@link #ERROR} .. {@link #TRACE}.
     * @return true if both the verbosity and the SLF4J logger accept the level.
     */
    public static boolean isEnabled(int messageLevel) {
        if (level < messageLevel) {
            return false;
        }
        switch (messageLevel) {
            case ERROR: return logger.isErrorEnabled();
            case WARN: return logger.isWarnEnabled();
            case INFO: return logger.isInfoEnabled();
            case DEBUG: return logger.isDebugEnabled();
            default: return logger.isTraceEnabled();
        }
    }

    public static void info(String msg) {
        if (isEnabled(INFO)) logger.info(msg);
    }

    public static void debug(String msg) {
        if (isEnabled(DEBUG)) logger.debug(msg);
    }

    public static void trace(String msg) {
        if (isEnabled(TRACE)) logger.trace(msg);
    }
}
