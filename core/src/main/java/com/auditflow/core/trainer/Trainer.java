package com.auditflow.core.trainer;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.ITrainer;
import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.model.Page;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * 감사 중 오간 응답에서 크롤러가 못 본 상태(새 폼/새 파라미터 조합)를 찾는다.
 *  - train 플래그가 붙은 요청의 응답만 본다(모듈이 명시적으로 요청)
 *  - 새 요소가 하나라도 있으면 응답을 Page 로 만들어 sink(= 페이지 큐)로 보낸다
 *  - 모듈 루프에 들어가는 페이지는 seed() 로 미리 등록해 중복 학습을 막는다
 */
public final class Trainer implements ITrainer {

    private static final Logger LOG = LoggerFactory.getLogger(Trainer.class);

    private final IHttpTransport http;
    private final ElementFilter filter;
    private final ScanOptions options;
    private final Consumer<Page> sink;
    private final Consumer<AuditResponse> listener = this::onResponse;

    public Trainer(IHttpTransport http, ElementFilter filter, ScanOptions options, Consumer<Page> sink) {
        this.http = Objects.requireNonNull(http, "http");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
        http.addResponseListener(listener);
    }

    /** 페이지의 요소를 학습 없이 등록만 */
    public void seed(Page page) {
        if (page == null || !page.isText()) return;
        filter.registerNew(signatures(page.getUrl(), page.getBody()));
    }

    void onResponse(AuditResponse resp) {
        if (!resp.request().train() || resp.isFailure()) return;

        Page page = Page.from(resp);
        if (!page.isText()) return;
        if (options.isSameDomainOnly() && options.getTarget() != null
                && !UrlUtils.sameDomain(page.getUrl(), options.getTarget())) {
            return;
        }

        int fresh = filter.registerNew(signatures(page.getUrl(), page.getBody()));
        if (fresh > 0) {
            LOG.debug("Trainer found {} new element(s) at {}", fresh, page.getUrl());
            sink.accept(page);
        }
    }

    /**
     * 요소 시그니처:
     *  form|METHOD|action(쿼리 제외)|정렬된 input 이름
     *  link|path|정렬된 쿼리 파라미터 이름   (쿼리가 있는 링크만)
     */
    static List<String> signatures(String url, String body) {
        List<String> out = new ArrayList<>();
        if (body == null || body.isBlank()) return out;

        Document doc = Jsoup.parse(body, url == null ? "" : url);

        for (Element form : doc.select("form")) {
            String action = form.hasAttr("action") ? form.attr("abs:action") : url;
            if (action == null || action.isBlank()) action = String.valueOf(url);
            String method = form.attr("method").isBlank() ? "GET" : form.attr("method").toUpperCase(Locale.ROOT);
            Set<String> names = new TreeSet<>();
            for (Element in : form.select("input[name], select[name], textarea[name]")) {
                names.add(in.attr("name"));
            }
            out.add("form|" + method + "|" + stripQuery(action) + "|" + String.join(",", names));
        }

        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            try {
                URI u = URI.create(abs.trim());
                if (u.getRawQuery() == null || u.getRawQuery().isBlank()) continue;
                Set<String> names = new TreeSet<>();
                for (String pair : u.getRawQuery().split("&")) {
                    int eq = pair.indexOf('=');
                    String n = (eq < 0) ? pair : pair.substring(0, eq);
                    if (!n.isEmpty()) names.add(n);
                }
                out.add("link|" + stripQuery(abs) + "|" + String.join(",", names));
            } catch (IllegalArgumentException ignore) {
                // 잘못된 URL은 무시
            }
        }
        return out;
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        String s = (q < 0) ? url : url.substring(0, q);
        int h = s.indexOf('#');
        return (h < 0) ? s : s.substring(0, h);
    }

    @Override
    public void reattach() {
        // 중복 등록 방지
        http.removeResponseListener(listener);
        http.addResponseListener(listener);
    }

    @Override
    public void close() {
        http.removeResponseListener(listener);
    }
}
