package com.auditflow.core.http;

/**
 * 트랜스포트 텔레메트리 스냅샷. stats() 에 그대로 전달된다.
 * 시간 단위는 모두 ms.
 */
public record HttpCounters(
        long requestCount,
        long responseCount,
        long timeoutCount,
        double currentResponseTime,
        long currentResponseCount,
        double currentResponsesPerSecond,
        double averageResponseTime,
        int maxConcurrency
) {
    public static final HttpCounters EMPTY = new HttpCounters(0, 0, 0, 0.0, 0, 0.0, 0.0, 0);
}
