package com.auditflow.core.model;

import java.util.Locale;

/**
 * 오케스트레이터 단계(순서대로 진행).
 * "paused" 는 단계가 아니라 status() 의 표시용 오버레이다.
 */
public enum ScanPhase {
    READY,
    PREPARING,
    CRAWLING,
    AUDITING,
    CLEANUP,
    DONE;

    /** status 문자열 표기(소문자) */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
