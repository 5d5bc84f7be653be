package com.auditflow.core.component;

/** 스캔과 병행 실행되는 부가 작업. prepare 에서 시작, cleanUp 에서 종료를 기다린다. */
@FunctionalInterface
public interface Plugin {

    void run() throws Exception;

    /** AuditStore.plugins 에 실릴 결과(없으면 null) */
    default Object results() { return null; }

    default void cleanUp() {}
}
