package com.dsflow.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicit, one-time logging setup for processes that use dsflow.
 *
 * <p>Data sources never configure logging themselves; the embedding application calls
 * {@link #initialize(Verbosity)} once, before building any source.
 */
public final class LoggingBootstrap {
    public static final String LOGGER_NAME = "com.dsflow";

    private static final Logger logger = LoggerFactory.getLogger(LoggingBootstrap.class);
    private static final AtomicBoolean initialized = new AtomicBoolean(false);

    private LoggingBootstrap() {}

    /**
     * Sets the level of the {@code com.dsflow} logger hierarchy.
     *
     * @return true if this call performed the initialization, false if it already happened
     */
    public static boolean initialize(Verbosity verbosity) {
        if (verbosity == null) throw new IllegalArgumentException("verbosity cannot be null");
        if (!initialized.compareAndSet(false, true)) {
            return false;
        }

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            LoggerContext ctx = (LoggerContext) factory;
            ctx.getLogger(LOGGER_NAME).setLevel(toLevel(verbosity));
            logger.info("dsflow logging initialized at {}", verbosity);
        } else {
            logger.warn("SLF4J binding {} is not Logback; leaving log levels untouched",
                    factory.getClass().getName());
        }
        return true;
    }

    public static boolean isInitialized() {
        return initialized.get();
    }

    static Level toLevel(Verbosity v) {
        switch (v) {
            case ERROR: return Level.ERROR;
            case WARN:  return Level.WARN;
            case INFO:  return Level.INFO;
            case TRACE: return Level.TRACE;
            case DEBUG:
            default:    return Level.DEBUG;
        }
    }

    /** Test hook. */
    static void reset() {
        initialized.set(false);
    }
}
