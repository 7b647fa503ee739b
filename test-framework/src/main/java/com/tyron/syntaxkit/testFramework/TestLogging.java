package com.tyron.syntaxkit.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Routes the {@code com.tyron.syntaxkit} loggers to a compact console handler during tests.
 * <p>
 * The level comes from {@code -Dsyntaxkit.test.logLevel} (default {@code INFO}); {@code FINE} shows
 * path resolution, diagnostic repositioning and mutation traces. Other loggers are left alone.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "syntaxkit.test.logLevel";

    static final String LOGGER_NAME = "com.tyron.syntaxkit";

    // kept reachable so the configuration is not lost to garbage collection
    private static final Logger SYNTAXKIT = Logger.getLogger(LOGGER_NAME);

    private static boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) {
            return;
        }
        configured = true;

        Level level = levelOf(System.getProperty(LEVEL_PROPERTY));
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(level);
        handler.setFormatter(new SyntaxKitFormatter());

        SYNTAXKIT.setLevel(level);
        SYNTAXKIT.setUseParentHandlers(false);
        SYNTAXKIT.addHandler(handler);
        SYNTAXKIT.config("test logging at " + level.getName());
    }

    /**
     * Parses a level name, case-insensitively; anything unparseable means {@code INFO}.
     */
    static Level levelOf(String name) {
        if (name == null || name.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    /**
     * {@code 12:00:00.000 FINE    TreePathResolver - message}, followed by the stack trace if any.
     */
    static final class SyntaxKitFormatter extends Formatter {

        private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

        @Override
        public String format(LogRecord record) {
            String time = TIME.format(LocalTime.ofInstant(record.getInstant(), ZoneId.systemDefault()));
            String source = record.getLoggerName() == null ? LOGGER_NAME : record.getLoggerName();
            String line = String.format(Locale.ROOT, "%s %-7s %s - %s%n",
                    time, record.getLevel().getName(), source.substring(source.lastIndexOf('.') + 1), formatMessage(record));
            if (record.getThrown() == null) {
                return line;
            }
            StringWriter trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            return line + trace;
        }
    }
}
