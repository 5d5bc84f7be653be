package com.auditflow.core.report;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReportNamingTest {

    @Test
    void host_and_slug() {
        assertThat(ReportNaming.host("http://Example.COM:8080/x")).isEqualTo("example.com");
        assertThat(ReportNaming.host("not a url")).isEqualTo("unknown-host");
        assertThat(ReportNaming.host(null)).isEqualTo("unknown-host");

        assertThat(ReportNaming.slug("https://example.com/a/b?q=1")).isEqualTo("example.com-a-b-q-1");
        assertThat(ReportNaming.slug("")).isEqualTo("no-url");
    }

    @Test
    void path_layout() {
        Instant ts = Instant.parse("2025-03-01T10:00:00Z");
        Path p = ReportNaming.reportPath(Path.of("out"), "http://example.com/", ts, "json");

        assertThat(p.getParent()).isEqualTo(Path.of("out", "reports", "example.com"));
        assertThat(p.getFileName().toString())
                .isEqualTo("scan-example.com-" + ReportNaming.TS_FMT.format(ts) + ".json");
    }
}
