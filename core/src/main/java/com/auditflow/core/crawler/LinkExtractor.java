package com.auditflow.core.crawler;

import java.net.URI;
import java.util.Set;

/** 응답 본문에서 절대 URL을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * @param base 상대 링크 해석 기준(리다이렉트 이후 URL)
     * @param html 응답 본문
     * @return http/https 절대 URI 집합(파싱 불가 링크는 제외)
     */
    Set<URI> extract(URI base, String html);
}
