package com.auditflow.core.component;

import com.auditflow.core.model.Page;

/**
 * 페이지 하나에 대한 점검 단위.
 * 발견 사항은 ScanContext.registerIssue 로, 지연 기반 점검은 ScanContext.timing() 에 적재한다.
 */
@FunctionalInterface
public interface AuditModule {

    void run(Page page) throws Exception;
}
