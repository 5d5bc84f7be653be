package com.auditflow.core.crawler;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.ISpider;
import com.auditflow.core.framework.PauseGate;
import com.auditflow.core.http.AuditRequest;
import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.model.Page;
import com.auditflow.core.model.RedundancyRule;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.util.StructuredLog;
import com.auditflow.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 트랜스포트 위에서 동작하는 깊이 단위 BFS 크롤러.
 *  - 깊이 한 단계를 전부 queue() 한 뒤 runQueued() 로 수확하고 다음 단계로 진행
 *  - sameDomainOnly, maxDepth, 중복 규칙(redundant) 적용
 *  - 요청 URL 과 최종 URL 이 다르면 요청 URL 을 redirects 에 기록(사이트맵에는 둘 다)
 *  - 발견 콜백에는 최종(effective) URL 을 넘긴다
 */
public final class LinkSpider implements ISpider {

    private static final Logger LOG = LoggerFactory.getLogger(LinkSpider.class);
    private static final StructuredLog SLOG = StructuredLog.get(LinkSpider.class);

    /** pause()/resume() 호출 주체가 하나(오케스트레이터)라 고정 토큰으로 횟수만 센다 */
    private static final Object PAUSE_TOKEN = new Object();

    private final ScanOptions options;
    private final IHttpTransport http;
    private final LinkExtractor extractor;
    private final PauseGate pauseGate = new PauseGate();

    private final Set<String> sitemap = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> redirects = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> visited = ConcurrentHashMap.newKeySet();

    public LinkSpider(ScanOptions options, IHttpTransport http) {
        this(options, http, new JsoupLinkExtractor());
    }

    public LinkSpider(ScanOptions options, IHttpTransport http, LinkExtractor extractor) {
        this.options = Objects.requireNonNull(options, "options");
        this.http = Objects.requireNonNull(http, "http");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public void run(boolean blocking, Consumer<String> onDiscovered) {
        final Consumer<String> cb = (onDiscovered != null) ? onDiscovered : u -> {};
        if (blocking) {
            crawl(cb);
            return;
        }
        Thread t = new Thread(() -> {
            try {
                crawl(cb);
            } catch (RuntimeException e) {
                LOG.warn("Background crawl failed", e);
            }
        }, "af-spider");
        t.setDaemon(true);
        t.start();
    }

    private void crawl(Consumer<String> onDiscovered) {
        String seed = UrlUtils.toAbsolute(options.getTarget(), null);
        if (seed == null) {
            LOG.warn("Spider has no valid seed: {}", options.getTarget());
            return;
        }
        final URI seedUri = URI.create(seed);
        final int maxDepth = Math.max(0, options.getMaxDepth());

        LOG.info("Crawl start: seed={}, maxDepth={}, sameDomainOnly={}", seed, maxDepth, options.isSameDomainOnly());
        visited.add(seed);
        List<String> frontier = List.of(seed);

        for (int depth = 0; !frontier.isEmpty(); depth++) {
            final int d = depth;
            final List<String> next = Collections.synchronizedList(new ArrayList<>());
            for (String url : frontier) {
                pauseGate.awaitIfPaused();
                final URI uri;
                try {
                    uri = URI.create(url);
                } catch (IllegalArgumentException e) {
                    LOG.debug("Skipping unparseable URL: {}", url);
                    continue;
                }
                http.queue(AuditRequest.get(uri), resp -> handle(resp, d, maxDepth, seedUri, next, onDiscovered));
            }
            http.runQueued();
            SLOG.debug("crawl-depth", "depth", depth, "fetched", frontier.size(), "next", next.size());

            synchronized (next) {
                frontier = new ArrayList<>(next);
            }
        }
        LOG.info("Crawl done: sitemap={}, redirects={}", sitemap.size(), redirects.size());
    }

    private void handle(AuditResponse resp, int depth, int maxDepth, URI seed,
                        List<String> next, Consumer<String> onDiscovered) {
        if (resp.isFailure()) {
            LOG.debug("Spider fetch failed: {}", resp.request().url());
            return;
        }
        String requested = resp.request().url().toString();
        String effective = UrlUtils.normalize(resp.effectiveUrl()).toString();
        sitemap.add(requested);

        if (!effective.equals(requested)) {
            redirects.add(requested);
            sitemap.add(effective);
            // 이미 본 곳으로 리다이렉트되면 다시 알리지 않는다
            if (!visited.add(effective)) return;
        }
        onDiscovered.accept(effective);

        if (depth >= maxDepth) return;
        Page page = Page.from(resp);
        if (!page.isText()) return;

        for (URI link : extractor.extract(resp.effectiveUrl(), page.getBody())) {
            String abs = UrlUtils.normalize(link).toString();
            if (options.isSameDomainOnly() && !UrlUtils.sameDomain(seed, link)) continue;
            if (visited.contains(abs)) continue;
            if (isRedundant(abs)) {
                LOG.debug("Redundant URL skipped: {}", abs);
                continue;
            }
            if (visited.add(abs)) next.add(abs);
        }
    }

    /** 매칭되는 규칙마다 허용치를 1 소모, 하나라도 소진되어 있으면 중복 취급 */
    private boolean isRedundant(String url) {
        for (RedundancyRule rule : options.getRedundant()) {
            if (rule.matches(url) && !rule.tryConsume()) return true;
        }
        return false;
    }

    @Override
    public void pause() {
        pauseGate.pause(PAUSE_TOKEN);
    }

    @Override
    public void resume() {
        pauseGate.resume(PAUSE_TOKEN);
    }

    public boolean isPaused() {
        return pauseGate.isPaused();
    }

    @Override
    public Collection<String> redirects() {
        synchronized (redirects) {
            return new ArrayList<>(redirects);
        }
    }

    @Override
    public Collection<String> sitemap() {
        synchronized (sitemap) {
            return new ArrayList<>(sitemap);
        }
    }
}
