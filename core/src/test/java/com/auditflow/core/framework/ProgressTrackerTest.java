package com.auditflow.core.framework;

import com.auditflow.core.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    @Test
    @DisplayName("일반 감사만: 감사맵/(사이트맵-리다이렉트) * 100")
    void plain_progress() {
        assertThat(ProgressTracker.progress(0, 4, 0, false, false, 0, 0)).isEqualTo(0.0);
        assertThat(ProgressTracker.progress(1, 4, 0, false, false, 0, 0)).isEqualTo(25.0);
        assertThat(ProgressTracker.progress(3, 4, 1, false, false, 0, 0)).isEqualTo(100.0);
        assertThat(ProgressTracker.progress(1, 3, 0, false, false, 0, 0)).isEqualTo(33.33);
    }

    @Test
    @DisplayName("분모가 0 이면 0.0")
    void zero_denominator() {
        assertThat(ProgressTracker.progress(0, 0, 0, false, false, 0, 0)).isEqualTo(0.0);
        assertThat(ProgressTracker.progress(2, 2, 2, false, false, 0, 0)).isEqualTo(0.0);
        // 타이밍이 실행 중인데 연산이 0개
        assertThat(ProgressTracker.progress(1, 1, 0, true, true, 0, 0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("타이밍 모듈이 있으면 50/50 분할")
    void timing_split() {
        assertThat(ProgressTracker.progress(1, 1, 0, true, false, 4, 4)).isEqualTo(50.0);
        assertThat(ProgressTracker.progress(1, 1, 0, true, true, 4, 4)).isEqualTo(50.0);
        assertThat(ProgressTracker.progress(1, 1, 0, true, true, 4, 2)).isEqualTo(75.0);
        assertThat(ProgressTracker.progress(1, 1, 0, true, true, 4, 0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("100 초과(사이트맵 축소 등)는 100 으로 자른다")
    void clamps_to_hundred() {
        assertThat(ProgressTracker.progress(5, 3, 0, false, false, 0, 0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("ETA: 진행 전 --:--:--, 완료 00:00:00, 그 사이는 선형 추정")
    void eta() {
        Instant start = Instant.parse("2025-03-01T10:00:00Z");
        MutableClock clock = new MutableClock(start);
        ProgressTracker t = new ProgressTracker(clock);

        assertThat(t.eta(0.0, start)).isEqualTo(ProgressTracker.ETA_UNKNOWN);
        assertThat(t.eta(50.0, null)).isEqualTo(ProgressTracker.ETA_UNKNOWN);
        assertThat(t.eta(100.0, start)).isEqualTo(ProgressTracker.ETA_DONE);

        clock.advance(Duration.ofMinutes(30));
        assertThat(t.eta(25.0, start)).isEqualTo("01:30:00");
        assertThat(t.eta(50.0, start)).isEqualTo("00:30:00");
    }

    @Test
    void format_pads_hours() {
        assertThat(ProgressTracker.format(Duration.ofSeconds(3 * 3600 + 61))).isEqualTo("03:01:01");
        assertThat(ProgressTracker.format(Duration.ofHours(120))).isEqualTo("120:00:00");
    }
}
