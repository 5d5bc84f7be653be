package com.auditflow.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanOptionsTest {

    @Test
    void validate_requires_target() {
        assertThatThrownBy(() -> ScanOptions.defaults().validate()).isInstanceOf(NullPointerException.class);
        ScanOptions.defaults().setTarget("http://example.test/").validate();
    }

    @Test
    @DisplayName("toMap 은 깊은 복사라 이후 변경에 영향받지 않는다")
    void to_map_is_detached() {
        ScanOptions o = ScanOptions.defaults().setTarget("http://example.test/").setRestrictPaths(List.of("/a"))
                .setRedundant(List.of(new RedundancyRule("cal", 2)));

        Map<String, Object> m = o.toMap();
        o.setRestrictPaths(List.of("/a", "/b"));
        o.getRedundant().get(0).tryConsume();

        assertThat(m.get("restrictPaths")).isEqualTo(List.of("/a"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rules = (List<Map<String, Object>>) m.get("redundant");
        assertThat(rules.get(0)).containsEntry("count", 2);
    }

    @Test
    void runtime_stamps_clear() {
        ScanOptions o = ScanOptions.defaults().setTarget("http://example.test/")
                .setStartDatetime(Instant.EPOCH).setFinishDatetime(Instant.EPOCH).setDeltaTime(Duration.ZERO);

        o.clearRuntimeStamps();

        assertThat(o.getStartDatetime()).isNull();
        assertThat(o.getFinishDatetime()).isNull();
        assertThat(o.getDeltaTime()).isNull();
        assertThat(o.getTarget()).isEqualTo("http://example.test/");
    }

    @Test
    @DisplayName("중복 규칙: 정규식 매칭, 허용치 소진 후 false, copy 는 독립")
    void redundancy_rule() {
        RedundancyRule r = new RedundancyRule("calendar\\.php", 2);
        RedundancyRule copy = r.copy();

        assertThat(r.matches("http://e.test/calendar.php?d=1")).isTrue();
        assertThat(r.matches("http://e.test/calendarXphp")).isFalse();
        assertThat(r.tryConsume()).isTrue();
        assertThat(r.tryConsume()).isTrue();
        assertThat(r.tryConsume()).isFalse();
        assertThat(r.getCount()).isZero();
        assertThat(copy.getCount()).isEqualTo(2);
    }

    @Test
    void page_text_detection() {
        assertThat(Page.builder().url("u").contentType("text/html").build().isText()).isTrue();
        assertThat(Page.builder().url("u").contentType("application/json").build().isText()).isTrue();
        assertThat(Page.builder().url("u").build().isText()).isTrue();
        assertThat(Page.builder().url("u").contentType("image/png").build().isText()).isFalse();
        assertThat(Page.builder().url("u").contentType("image/png").text(true).build().isText()).isTrue();
    }

    @Test
    void issue_unique_key() {
        Issue a = Issue.builder().module("xss").name("Reflected").url("http://e.test/").variable("q").build();
        Issue b = Issue.builder().module("xss").name("Reflected").url("http://e.test/").variable("q")
                .severity(Severity.HIGH).evidence("<script>").build();

        assertThat(a.uniqueKey()).isEqualTo(b.uniqueKey()).isEqualTo("xss|Reflected|http://e.test/|-|q");
        assertThatThrownBy(() -> Issue.builder().module("m").name("n").build()).isInstanceOf(NullPointerException.class);
    }
}
