package com.tyron.syntaxkit.testFramework;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static com.google.common.truth.Truth.assertThat;

public class TestLoggingTest {

    @Test
    public void levelNamesAreLenient() {
        Assertions.assertEquals(Level.FINE, TestLogging.levelOf(" fine "));
        Assertions.assertEquals(Level.WARNING, TestLogging.levelOf("WARNING"));
        Assertions.assertEquals(Level.INFO, TestLogging.levelOf("loud"));
        Assertions.assertEquals(Level.INFO, TestLogging.levelOf(null));
    }

    @Test
    public void onlySyntaxKitLoggersGetTheHandler() {
        TestLogging.configureOnce();
        TestLogging.configureOnce();

        Logger syntaxkit = Logger.getLogger(TestLogging.LOGGER_NAME);
        Assertions.assertFalse(syntaxkit.getUseParentHandlers());
        Assertions.assertEquals(1, syntaxkit.getHandlers().length);
        Assertions.assertInstanceOf(ConsoleHandler.class, syntaxkit.getHandlers()[0]);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            assertThat(handler.getFormatter()).isNotInstanceOf(TestLogging.SyntaxKitFormatter.class);
        }
    }

    @Test
    public void recordsAreFormattedOnOneLine() {
        LogRecord record = new LogRecord(Level.FINE, "resolved {0}");
        record.setLoggerName("com.tyron.syntaxkit.core.path.TreePathResolver");
        record.setParameters(new Object[]{"1.2"});

        String line = new TestLogging.SyntaxKitFormatter().format(record);

        assertThat(line).matches("\\d{2}:\\d{2}:\\d{2}\\.\\d{3} FINE    TreePathResolver - resolved 1\\.2\\R");
    }

    @Test
    public void thrownIsAppendedAsStackTrace() {
        LogRecord record = new LogRecord(Level.WARNING, "bad settings");
        record.setLoggerName("com.tyron.syntaxkit.core.config.SettingsLoader");
        record.setThrown(new IllegalArgumentException("contextRadius < 0"));

        String text = new TestLogging.SyntaxKitFormatter().format(record);

        assertThat(text).contains("WARNING SettingsLoader - bad settings");
        assertThat(text).contains("java.lang.IllegalArgumentException: contextRadius < 0");
    }
}
