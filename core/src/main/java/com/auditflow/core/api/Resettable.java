package com.auditflow.core.api;

/** 스캔 간 재사용되는 협력자의 상태 초기화 계약. */
public interface Resettable {
    void reset();
}
