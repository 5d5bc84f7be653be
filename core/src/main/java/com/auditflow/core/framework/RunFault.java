package com.auditflow.core.framework;

import java.time.Instant;

/** run() 장벽에서 흡수된 단계별 오류 기록(stage: audit, timing, finalize, report) */
public record RunFault(String stage, Throwable error, Instant at) {
}
