package com.auditflow.core.framework;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * 진행률(0~100)과 ETA 계산.
 *
 * 일반 감사 진행률 = 감사맵 / (사이트맵 - 리다이렉트) * 가중치.
 * 타이밍 점검 모듈이 있으면 가중치를 50으로 낮추고, 실행 중일 때
 * (전체 연산 - 남은 연산) / 전체 연산 * 50 을 더한다.
 * 계산 결과가 유한하지 않으면(0 나누기 등) 0.0.
 */
public final class ProgressTracker {

    public static final String ETA_UNKNOWN = "--:--:--";
    public static final String ETA_DONE = "00:00:00";

    private final Clock clock;

    public ProgressTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static double progress(int auditmapSize, int sitemapSize, int redirectCount,
                                  boolean timingLoaded, boolean timingRunning,
                                  int totalTimingOps, int pendingTimingOps) {
        double multi = timingLoaded ? 50.0 : 100.0;
        double p = ((double) auditmapSize / (sitemapSize - redirectCount)) * multi;
        if (timingRunning) {
            p += ((double) (totalTimingOps - pendingTimingOps) / totalTimingOps) * multi;
        }
        if (!Double.isFinite(p)) return 0.0;

        p = BigDecimal.valueOf(p).setScale(2, RoundingMode.HALF_UP).doubleValue();
        if (p > 100.0) return 100.0;
        if (p < 0.0) return 0.0;
        return p;
    }

    /** 진행률과 시작 시각으로 남은 시간 추정(HH:MM:SS) */
    public String eta(double progress, Instant start) {
        if (start == null || progress <= 0.0) return ETA_UNKNOWN;
        if (progress >= 100.0) return ETA_DONE;

        long elapsedMs = Math.max(0, Duration.between(start, clock.instant()).toMillis());
        long totalMs = (long) (elapsedMs * 100.0 / progress);
        return format(Duration.ofMillis(Math.max(0, totalMs - elapsedMs)));
    }

    static String format(Duration d) {
        long s = d.getSeconds();
        return String.format(Locale.ROOT, "%02d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }
}
