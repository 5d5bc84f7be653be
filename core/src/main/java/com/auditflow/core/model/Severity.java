package com.auditflow.core.model;

/** 이슈 심각도 (낮은 것 → 높은 것 순서) */
public enum Severity {
    INFORMATIONAL,
    LOW,
    MEDIUM,
    HIGH
}
