package com.auditflow.core.report;

import com.auditflow.core.component.Report;
import com.auditflow.core.component.ScanContext;
import com.auditflow.core.model.AuditStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * AuditStore 를 그대로 pretty JSON 으로 기록.
 * 경로는 ReportNaming 규칙을 따른다.
 */
public final class JsonReport implements Report {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReport.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final ScanContext ctx;
    private volatile Path lastWritten;

    public JsonReport(ScanContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run(AuditStore store) throws IOException {
        Path out = ReportNaming.reportPath(ctx.options().getOutputDir(), ctx.options().getTarget(),
                store.getStartDatetime(), "json");
        Files.createDirectories(out.getParent());
        MAPPER.writeValue(out.toFile(), store);
        lastWritten = out;
        LOG.info("JSON report written: {}", out.toAbsolutePath());
    }

    /** 마지막으로 기록한 파일(없으면 null) */
    public Path lastWritten() {
        return lastWritten;
    }
}
