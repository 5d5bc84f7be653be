package com.auditflow.core.component;

import com.auditflow.core.model.AuditStore;

import java.io.IOException;

/** 스캔 결과 스냅샷을 소비하는 출력기 */
@FunctionalInterface
public interface Report {

    void run(AuditStore store) throws IOException;
}
