package com.auditflow.core.report;

import com.auditflow.core.component.ComponentFactory;
import com.auditflow.core.component.ComponentInfo;
import com.auditflow.core.component.ComponentProvider;
import com.auditflow.core.component.Report;

import java.util.List;

/** 코어에 포함된 리포트. ServiceLoader 로 등록된다. */
public final class BuiltinReports implements ComponentProvider {

    @Override
    public List<ComponentFactory<Report>> reports() {
        return List.of(
                ComponentFactory.of(
                        new ComponentInfo("json", "Writes the audit snapshot as JSON",
                                List.of("AuditFlow"), "0.3", "reports/json", 0),
                        JsonReport::new),
                ComponentFactory.of(
                        new ComponentInfo("summary", "Logs issue counts by severity",
                                List.of("AuditFlow"), "0.3", "reports/summary", 0),
                        ctx -> new SummaryReport())
        );
    }
}
