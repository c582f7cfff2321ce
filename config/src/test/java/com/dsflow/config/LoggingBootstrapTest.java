package com.dsflow.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LoggingBootstrapTest {

    @AfterEach
    void reset() {
        LoggingBootstrap.reset();
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(LoggingBootstrap.LOGGER_NAME).setLevel(null);
    }

    @Test
    void initializeSetsLevelOnce() {
        assertTrue(LoggingBootstrap.initialize(Verbosity.WARN));
        assertFalse(LoggingBootstrap.initialize(Verbosity.TRACE), "second call must be a no-op");

        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals(Level.WARN, ctx.getLogger(LoggingBootstrap.LOGGER_NAME).getLevel());
        assertTrue(LoggingBootstrap.isInitialized());
    }

    @Test
    void nullVerbosityRejected() {
        assertThrows(IllegalArgumentException.class, () -> LoggingBootstrap.initialize(null));
    }

    @Test
    void verbosityMapsToLogbackLevels() {
        assertEquals(Level.ERROR, LoggingBootstrap.toLevel(Verbosity.ERROR));
        assertEquals(Level.DEBUG, LoggingBootstrap.toLevel(Verbosity.DEBUG));
        assertEquals(Level.TRACE, LoggingBootstrap.toLevel(Verbosity.TRACE));
    }
}
