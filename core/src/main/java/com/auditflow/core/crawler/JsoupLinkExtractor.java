package com.auditflow.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSoup 기반 링크 추출기.
 * a/area/link[href], form[action], frame/iframe[src] 을 abs: 속성으로 수집.
 */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final String[][] SOURCES = {
            {"a[href]", "href"},
            {"area[href]", "href"},
            {"link[href]", "href"},
            {"form[action]", "action"},
            {"frame[src]", "src"},
            {"iframe[src]", "src"},
    };

    @Override
    public Set<URI> extract(URI base, String html) {
        Set<URI> out = new LinkedHashSet<>();
        if (base == null || html == null || html.isBlank()) return out;

        Document doc = Jsoup.parse(html, base.toString());
        for (String[] src : SOURCES) {
            for (Element el : doc.select(src[0])) {
                String abs = el.attr("abs:" + src[1]);
                if (abs == null || abs.isBlank()) continue;
                try {
                    URI u = URI.create(abs.trim());
                    String s = u.getScheme();
                    if (s == null) continue;
                    if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                    out.add(u);
                } catch (IllegalArgumentException ignore) {
                    // 잘못된 URL은 무시
                }
            }
        }
        return out;
    }
}
