package com.auditflow.core.http;

import com.auditflow.core.model.Page;
import com.auditflow.core.support.FakeTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {

    @Test
    @DisplayName("harvest 전에는 콜백이 오지 않는다")
    void callbacks_wait_for_harvest() {
        FakeTransport http = new FakeTransport();
        List<Page> pages = new ArrayList<>();

        new PageFetcher(http).fetch("http://example.test/a", 1, pages::add);
        assertThat(pages).isEmpty();
        assertThat(http.pending()).isEqualTo(1);

        http.runQueued();
        assertThat(pages).extracting(Page::getUrl).containsExactly("http://example.test/a");
    }

    @Test
    @DisplayName("실패하면 precision 회까지 같은 harvest 안에서 재시도")
    void retries_up_to_precision() {
        AtomicInteger attempts = new AtomicInteger();
        FakeTransport http = new FakeTransport().respond(req ->
                attempts.incrementAndGet() < 2 ? AuditResponse.failure(req, 0, true) : FakeTransport.html(req));
        List<Page> pages = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        new PageFetcher(http).fetch("http://example.test/flaky", 2, pages::add, failed::add);
        http.runQueued();

        assertThat(attempts).hasValue(2);
        assertThat(pages).hasSize(1);
        assertThat(failed).isEmpty();
    }

    @Test
    @DisplayName("모든 시도가 실패하면 onFailure(url)")
    void gives_up_after_precision() {
        FakeTransport http = new FakeTransport().respond(req -> AuditResponse.failure(req, 0, false));
        List<Page> pages = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        new PageFetcher(http).fetch("http://example.test/down", 3, pages::add, failed::add);
        http.runQueued();

        assertThat(http.sent).hasSize(3);
        assertThat(pages).isEmpty();
        assertThat(failed).containsExactly("http://example.test/down");
    }

    @Test
    @DisplayName("해석할 수 없는 URL 은 요청 없이 바로 실패")
    void unparseable_url() {
        FakeTransport http = new FakeTransport();
        List<String> failed = new ArrayList<>();

        new PageFetcher(http).fetch("http://exa mple/ bad", 2, p -> {}, failed::add);

        assertThat(failed).containsExactly("http://exa mple/ bad");
        assertThat(http.pending()).isZero();
    }

    @Test
    @DisplayName("페이지 URL 은 리다이렉트 이후 최종 URL")
    void page_uses_effective_url() {
        FakeTransport http = new FakeTransport().respond(req -> new AuditResponse(req,
                java.net.URI.create("http://example.test/landing"), 200,
                Map.of("Content-Type", List.of("application/octet-stream")), "bin", 1, false));
        List<Page> pages = new ArrayList<>();

        new PageFetcher(http).fetch("http://example.test/go", 1, pages::add);
        http.runQueued();

        assertThat(pages.get(0).getUrl()).isEqualTo("http://example.test/landing");
        assertThat(pages.get(0).isText()).isFalse();
    }
}
