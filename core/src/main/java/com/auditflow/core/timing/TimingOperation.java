package com.auditflow.core.timing;

import java.util.Objects;

/**
 * 지연 기반 점검 1건.
 * action 은 점검 대상 요소(폼 action 등)의 URL 로, 실행 중 currentUrl 표시용이다.
 */
public record TimingOperation(String module, String action, Runnable task) {

    public TimingOperation {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(task, "task");
        action = (action == null) ? "" : action;
    }
}
