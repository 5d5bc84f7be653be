package com.auditflow.core.model;

import com.auditflow.core.http.AuditResponse;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 페치된 감사 단위. 페이지 큐가 잠시 소유하고 모듈 루프가 한 번 소비한다.
 */
public final class Page {
    private final String url;
    private final int code;
    private final boolean text;
    private final String body;
    private final String contentType;
    private final Map<String, List<String>> headers;

    private Page(Builder b) {
        this.url = b.url;
        this.code = b.code;
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.text = (b.text != null) ? b.text : isTextual(b.contentType);
    }

    public String getUrl() { return url; }
    public int getCode() { return code; }
    public boolean isText() { return text; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public Map<String, List<String>> getHeaders() { return headers; }

    /** 응답으로부터 페이지 구성. URL은 리다이렉트 이후의 effective URL 기준 */
    public static Page from(AuditResponse resp) {
        Objects.requireNonNull(resp, "resp");
        return builder()
                .url(resp.effectiveUrl().toString())
                .code(resp.status())
                .body(resp.body())
                .contentType(resp.contentType())
                .headers(resp.headers())
                .build();
    }

    /** Content-Type 이 없으면 텍스트로 간주 */
    static boolean isTextual(String contentType) {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/")
                || ct.contains("json")
                || ct.contains("xml")
                || ct.contains("javascript")
                || ct.contains("x-www-form-urlencoded");
    }

    @Override
    public String toString() {
        return "Page[" + code + " " + url + "]";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int code = 200;
        private Boolean text;
        private String body;
        private String contentType;
        private Map<String, List<String>> headers;

        public Builder url(String url) { this.url = url; return this; }
        public Builder code(int code) { this.code = code; return this; }
        /** 명시하지 않으면 contentType 으로 판정 */
        public Builder text(boolean text) { this.text = text; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }

        public Page build() {
            Objects.requireNonNull(url, "url");
            return new Page(this);
        }
    }
}
