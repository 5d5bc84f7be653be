package com.auditflow.core.report;

import com.auditflow.core.component.Report;
import com.auditflow.core.model.AuditStore;
import com.auditflow.core.model.Issue;
import com.auditflow.core.model.Severity;
import com.auditflow.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/** 심각도별 건수 요약을 로그로 출력 */
public final class SummaryReport implements Report {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryReport.class);
    private static final StructuredLog SLOG = StructuredLog.get(SummaryReport.class);

    @Override
    public void run(AuditStore store) {
        Map<Severity, Integer> bySeverity = countBySeverity(store);
        LOG.info("Summary: target={}, pages={}, issues={} (high={}, medium={}, low={}, info={}), elapsed={}",
                store.getOptions().get("target"),
                store.getSitemap().size(),
                store.getIssues().size(),
                bySeverity.get(Severity.HIGH),
                bySeverity.get(Severity.MEDIUM),
                bySeverity.get(Severity.LOW),
                bySeverity.get(Severity.INFORMATIONAL),
                store.getDeltaTime());
        SLOG.info("summary",
                "pages", store.getSitemap().size(),
                "issues", store.getIssues().size(),
                "high", bySeverity.get(Severity.HIGH),
                "medium", bySeverity.get(Severity.MEDIUM));
    }

    static Map<Severity, Integer> countBySeverity(AuditStore store) {
        Map<Severity, Integer> m = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) m.put(s, 0);
        for (Issue i : store.getIssues()) m.merge(i.getSeverity(), 1, Integer::sum);
        return m;
    }
}
