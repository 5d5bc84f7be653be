package com.auditflow.core.model;

import java.time.Duration;

/**
 * stats() 한 번의 결과(불변).
 *
 * @param requests          HTTP 요청 수
 * @param responses         HTTP 응답 수
 * @param timeOutCount      타임아웃 요청 수
 * @param time              경과 시간(사이트맵과 감사맵이 같아지면 고정)
 * @param avg               초당 평균 응답 수
 * @param sitemapSize       발견 URL 수
 * @param auditmapSize      감사 완료 URL 수
 * @param progress          0~100
 * @param currResTime       현재 버스트의 평균 응답 시간(ms)
 * @param currResCnt        현재 버스트의 응답 수
 * @param currAvg           현재 버스트의 초당 응답 수
 * @param averageResTime    전체 평균 응답 시간(ms)
 * @param maxConcurrency    HTTP 최대 동시성
 * @param currentPage       현재 감사 중인 URL
 * @param eta               남은 예상 시간 HH:MM:SS
 */
public record StatsSnapshot(
        long requests,
        long responses,
        long timeOutCount,
        Duration time,
        long avg,
        int sitemapSize,
        int auditmapSize,
        double progress,
        double currResTime,
        long currResCnt,
        double currAvg,
        double averageResTime,
        int maxConcurrency,
        String currentPage,
        String eta
) {}
