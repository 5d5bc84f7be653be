package com.auditflow.core.http;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.IPageFactory;
import com.auditflow.core.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.function.Consumer;

/** 트랜스포트 위에서 동작하는 기본 페이지 팩토리. 실패 시 precision 회까지 재시도 */
public final class PageFetcher implements IPageFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    private final IHttpTransport http;

    public PageFetcher(IHttpTransport http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public void fetch(String url, int precision, Consumer<Page> onReady, Consumer<String> onFailure) {
        Objects.requireNonNull(onReady, "onReady");
        final Consumer<String> fail = (onFailure != null) ? onFailure : u -> {};
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            LOG.debug("Unparseable URL, skipping: {}", url);
            fail.accept(url);
            return;
        }
        attempt(uri, url, 1, Math.max(1, precision), onReady, fail);
    }

    private void attempt(URI uri, String url, int attempt, int maxAttempts,
                         Consumer<Page> onReady, Consumer<String> onFailure) {
        http.queue(AuditRequest.get(uri), resp -> {
            if (!resp.isFailure()) {
                onReady.accept(Page.from(resp));
            } else if (attempt < maxAttempts) {
                // 같은 harvest 안에서 재시도(runQueued 가 콜백이 쌓은 요청까지 처리)
                attempt(uri, url, attempt + 1, maxAttempts, onReady, onFailure);
            } else {
                LOG.debug("Could not fetch {} after {} attempt(s)", url, attempt);
                onFailure.accept(url);
            }
        });
    }
}
