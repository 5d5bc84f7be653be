package com.auditflow.core.component;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.model.Issue;
import com.auditflow.core.model.Page;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.timing.TimingAuditor;

/**
 * 컴포넌트(모듈/플러그인/리포트)에 노출되는 스캔 환경.
 * 컴포넌트는 오케스트레이터 내부가 아닌 이 계약만 본다.
 */
public interface ScanContext {

    ScanOptions options();

    IHttpTransport http();

    TimingAuditor timing();

    /** 발견 사항 등록(모듈 결과에 누적, uniqueKey 로 중복 제거) */
    void registerIssue(Issue issue);

    void pushPage(Page page);

    void pushUrl(String url);
}
