package com.auditflow.core;

import com.auditflow.core.api.ISession;
import com.auditflow.core.framework.ScanOrchestrator;
import com.auditflow.core.framework.SharedState;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.support.FakeSpider;
import com.auditflow.core.support.FakeTransport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanRunnerTest {

    private static ScanOrchestrator orchestrator(ScanOptions o) {
        return ScanOrchestrator.builder(o)
                .shared(new SharedState(new FakeTransport()))
                .spider(x -> new FakeSpider())
                .session(ISession.NONE)
                .build();
    }

    @Test
    void lists_builtin_reports() {
        ScanOptions o = ScanOptions.defaults().setTarget("http://example.test/");

        List<String> lines = ScanRunner.list(orchestrator(o), "lsrep");

        assertThat(lines).anyMatch(l -> l.startsWith("json") && l.contains("reports/json"));
        assertThat(lines).anyMatch(l -> l.startsWith("summary"));
    }

    @Test
    void listing_respects_filters() {
        ScanOptions o = ScanOptions.defaults().setTarget("http://example.test/").setLsrep(List.of("json$"));

        assertThat(ScanRunner.list(orchestrator(o), "lsrep")).hasSize(1);
        assertThat(ScanRunner.list(orchestrator(o), "lsplug")).isEmpty();
    }

    @Test
    void unknown_listing() {
        ScanOptions o = ScanOptions.defaults().setTarget("http://example.test/");

        assertThatThrownBy(() -> ScanRunner.list(orchestrator(o), "lsfoo"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
