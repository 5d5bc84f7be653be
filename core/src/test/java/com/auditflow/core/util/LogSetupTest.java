package com.auditflow.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    @DisplayName("레벨 이름: JUL 이름과 SLF4J 식 이름 모두, 모르면 INFO")
    void level_names() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("debug")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARN ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("error")).isEqualTo(Level.SEVERE);
        assertThat(LogSetup.levelOf("nope")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void settings_from_properties() {
        Properties p = new Properties();
        assertThat(LogSetup.Settings.from(p))
                .isEqualTo(new LogSetup.Settings(Level.INFO, 2, 5, true));

        p.setProperty("af.log.level", "FINE");
        p.setProperty("af.log.sizeMb", "x");
        p.setProperty("af.log.files", "0");
        p.setProperty("af.log.console", "false");
        LogSetup.Settings s = LogSetup.Settings.from(p);

        assertThat(s).isEqualTo(new LogSetup.Settings(Level.FINE, 2, 1, false));
        assertThat(s.limitBytes()).isEqualTo(2 * 1024 * 1024);
    }

    @Test
    @DisplayName("구조화 이벤트 로거만 이벤트 파일로, 원문 그대로")
    void event_routing_and_format() {
        LogRecord event = new LogRecord(Level.INFO, "{\"event\":\"scan-done\"}");
        event.setLoggerName("com.auditflow.core.framework.ScanOrchestrator.events");
        LogRecord human = new LogRecord(Level.WARNING, "Module {0} failed");
        human.setLoggerName("com.auditflow.core.component.ModuleManager");
        human.setParameters(new Object[]{"xss"});
        human.setThrown(new IllegalStateException("boom"));

        assertThat(LogSetup.isEvent(event)).isTrue();
        assertThat(LogSetup.isEvent(human)).isFalse();
        assertThat(new LogSetup.EventFormatter().format(event)).isEqualTo("{\"event\":\"scan-done\"}\n");

        String line = new LogSetup.LineFormatter().format(human);
        assertThat(line).contains("[WARNING]", "ModuleManager - Module xss failed", "IllegalStateException: boom");
    }
}
