package com.auditflow.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    @DisplayName("정규화: fragment 제거, 소문자 host, 기본 포트 제거, 빈 경로는 /")
    void normalize() {
        assertThat(UrlUtils.normalize(URI.create("HTTP://Example.COM:80")).toString()).isEqualTo("http://example.com/");
        assertThat(UrlUtils.normalize(URI.create("https://a.test:443//x//y?q=1#frag")).toString())
                .isEqualTo("https://a.test/x/y?q=1");
        assertThat(UrlUtils.normalize(URI.create("http://a.test:8080/p")).toString()).isEqualTo("http://a.test:8080/p");
    }

    @Test
    @DisplayName("toAbsolute: 상대경로는 base 기준, http(s) 가 아니거나 host 가 없으면 null")
    void to_absolute() {
        assertThat(UrlUtils.toAbsolute("/a", "http://example.test")).isEqualTo("http://example.test/a");
        assertThat(UrlUtils.toAbsolute("b?x=1", "http://example.test/dir/")).isEqualTo("http://example.test/dir/b?x=1");
        assertThat(UrlUtils.toAbsolute("HTTP://Other.test/z#f", "http://example.test/")).isEqualTo("http://other.test/z");
        assertThat(UrlUtils.toAbsolute("mailto:x@y.z", "http://example.test/")).isNull();
        assertThat(UrlUtils.toAbsolute("/a", null)).isNull();
        assertThat(UrlUtils.toAbsolute("  ", "http://example.test/")).isNull();
        assertThat(UrlUtils.toAbsolute("http://bad host/", null)).isNull();
    }

    @Test
    void same_domain() {
        assertThat(UrlUtils.sameDomain("http://A.test/x", "https://a.test:8443/y")).isTrue();
        assertThat(UrlUtils.sameDomain("http://a.test/", "http://b.test/")).isFalse();
        assertThat(UrlUtils.sameDomain("http://a.test/", null)).isFalse();
    }

    @Test
    @DisplayName("RegexFilters: 비어 있으면 통과, 모든 패턴(대소문자 무시)이 매칭되어야 통과")
    void regex_filters() {
        assertThat(RegexFilters.allMatch(List.of(), "anything")).isTrue();
        assertThat(RegexFilters.allMatch(null, "anything")).isTrue();
        assertThat(RegexFilters.allMatch(List.of("AUDIT", "xss"), "modules/audit/xss")).isTrue();
        assertThat(RegexFilters.allMatch(List.of("audit", "sqli"), "modules/audit/xss")).isFalse();
        assertThat(RegexFilters.allMatch(List.of("audit"), null)).isFalse();
    }
}
