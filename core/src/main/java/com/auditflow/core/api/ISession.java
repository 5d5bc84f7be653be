package com.auditflow.core.api;

/** 로그인 세션 유지. harvest 직후마다 호출된다. */
public interface ISession {

    void ensureLoggedIn();

    /** 세션 관리가 필요 없는 경우 */
    ISession NONE = () -> {};
}
