package com.auditflow.core.api;

import java.util.Collection;
import java.util.function.Consumer;

/**
 * 크롤러 계약. 발견 URL 은 콜백으로 흘려보내고, 리다이렉트/사이트맵은 조회로 노출한다.
 */
public interface ISpider {

    /**
     * @param blocking     true 면 크롤이 끝날 때까지 반환하지 않음
     * @param onDiscovered 발견(effective) URL 마다 호출
     */
    void run(boolean blocking, Consumer<String> onDiscovered);

    void pause();

    void resume();

    /** 리다이렉트를 일으킨 요청 URL 목록 */
    Collection<String> redirects();

    /** 스파이더가 지금까지 본 URL 전체 */
    Collection<String> sitemap();
}
