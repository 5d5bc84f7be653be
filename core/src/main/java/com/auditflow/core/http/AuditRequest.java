package com.auditflow.core.http;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * 트랜스포트 큐에 들어가는 요청 명세.
 * train=true 인 요청의 응답만 Trainer 가 새 상태 탐색에 사용한다.
 */
public record AuditRequest(URI url, String method, Map<String, String> headers, String body, boolean train) {

    public AuditRequest {
        Objects.requireNonNull(url, "url");
        method = (method == null || method.isBlank()) ? "GET" : method;
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    public static AuditRequest get(URI url) {
        return new AuditRequest(url, "GET", Map.of(), null, false);
    }

    public static AuditRequest get(String url) {
        return get(URI.create(url));
    }

    public AuditRequest withTrain(boolean train) {
        return new AuditRequest(url, method, headers, body, train);
    }
}
