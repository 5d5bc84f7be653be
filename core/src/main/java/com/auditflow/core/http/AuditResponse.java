package com.auditflow.core.http;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 트랜스포트가 완료 콜백에 넘기는 응답. 네트워크 실패는 status -1 로 표현(예외 대신).
 */
public record AuditResponse(AuditRequest request,
                            URI effectiveUrl,
                            int status,
                            Map<String, List<String>> headers,
                            String body,
                            long timeMs,
                            boolean timedOut) {

    public AuditResponse {
        Objects.requireNonNull(request, "request");
        effectiveUrl = (effectiveUrl == null) ? request.url() : effectiveUrl;
        headers = (headers == null) ? Map.of() : headers;
        body = (body == null) ? "" : body;
    }

    public static AuditResponse failure(AuditRequest request, long timeMs, boolean timedOut) {
        return new AuditResponse(request, request.url(), -1, Map.of(), "", timeMs, timedOut);
    }

    public boolean isFailure() {
        return status < 0;
    }

    /** 요청 URL 과 최종 URL 이 다르면 리다이렉트를 거친 것 */
    public boolean isRedirected() {
        return !request.url().equals(effectiveUrl);
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    public String contentType() {
        return header("Content-Type");
    }
}
