package com.auditflow.core.component;

import com.auditflow.core.model.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/** 리포트 레지스트리. 리포트 하나의 실패가 다른 리포트를 막지 않는다. */
public final class ReportManager extends ComponentManager<Report> {

    private static final Logger LOG = LoggerFactory.getLogger(ReportManager.class);

    public ReportManager(ScanContext ctx) {
        super("report", ctx);
    }

    /** @return 성공한 리포트 수 */
    public int run(AuditStore store) {
        int ok = 0;
        for (Map.Entry<String, Report> e : loadedComponents().entrySet()) {
            try {
                e.getValue().run(store);
                ok++;
            } catch (IOException | RuntimeException ex) {
                LOG.warn("Report {} failed: {}", e.getKey(), ex.toString(), ex);
            }
        }
        return ok;
    }
}
