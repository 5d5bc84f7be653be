package com.auditflow.core.api;

import com.auditflow.core.model.Page;

import java.util.function.Consumer;

/**
 * URL → Page 비동기 생성 계약. 요청은 큐에만 쌓이고, 호출자가 harvest 해야 콜백이 온다.
 */
public interface IPageFactory {

    /**
     * @param precision 최대 시도 횟수(1 이상)
     * @param onReady   페이지 생성 성공 시
     * @param onFailure 모든 시도 실패 시 요청 URL 전달
     */
    void fetch(String url, int precision, Consumer<Page> onReady, Consumer<String> onFailure);

    /** 실패는 조용히 버리는 버전 */
    default void fetch(String url, int precision, Consumer<Page> onReady) {
        fetch(url, precision, onReady, u -> {});
    }
}
