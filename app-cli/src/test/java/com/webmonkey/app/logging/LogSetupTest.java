package com.webmonkey.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_acceptsJulAndSlf4jNames() {
        assertThat(LogSetup.levelOf("debug")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARN ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("error")).isEqualTo(Level.SEVERE);
        assertThat(LogSetup.levelOf("FINER")).isEqualTo(Level.FINER);
        assertThat(LogSetup.levelOf("nonsense")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void lineFormatter_oneLinePlusStack() {
        LogRecord r = new LogRecord(Level.WARNING, "fetch failed: {0}");
        r.setParameters(new Object[]{"https://ex.com/"});
        r.setLoggerName("com.webmonkey.core.crawler.Crawler");

        String plain = new LogSetup.LineFormatter().format(r);
        assertThat(plain)
                .contains("[WARNING]")
                .contains("com.webmonkey.core.crawler.Crawler - fetch failed: https://ex.com/")
                .endsWith(System.lineSeparator());

        r.setThrown(new IllegalStateException("boom"));
        assertThat(new LogSetup.LineFormatter().format(r)).contains("java.lang.IllegalStateException: boom");
    }
}
