package com.auditflow.core.api;

import com.auditflow.core.http.AuditRequest;
import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.http.HttpCounters;

import java.util.function.Consumer;

/**
 * HTTP 트랜스포트 최소 계약.
 * queue() 는 즉시 반환하고, runQueued() 가 큐에 쌓인 요청과
 * 완료 콜백이 새로 쌓은 요청까지 모두 끝날 때까지 블록한다.
 */
public interface IHttpTransport extends Resettable {

    void queue(AuditRequest request, Consumer<AuditResponse> onComplete);

    /** 큐/진행 중 요청을 모두 해소(harvest). */
    void runQueued();

    /** 모든 응답을 관찰하는 리스너(Trainer 주입 지점) */
    void addResponseListener(Consumer<AuditResponse> listener);

    void removeResponseListener(Consumer<AuditResponse> listener);

    HttpCounters counters();
}
