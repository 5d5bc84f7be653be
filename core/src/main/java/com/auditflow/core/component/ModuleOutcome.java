package com.auditflow.core.component;

/**
 * 모듈 1회 실행 결과. fault 가 null 이면 정상 종료.
 */
public record ModuleOutcome(String module, String url, long elapsedMs, Throwable fault) {

    public static ModuleOutcome ok(String module, String url, long elapsedMs) {
        return new ModuleOutcome(module, url, elapsedMs, null);
    }

    public static ModuleOutcome failed(String module, String url, long elapsedMs, Throwable fault) {
        return new ModuleOutcome(module, url, elapsedMs, fault);
    }

    public boolean isOk() {
        return fault == null;
    }
}
