package com.auditflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 스캔 결과 스냅샷. 리포트가 소비하며 Jackson 으로 직렬화 가능.
 * options 의 redundant 항목은 스캔 시작 전 카운터 값으로 복원되어 있다.
 */
public final class AuditStore {
    private final String version;
    private final String revision;
    private final Map<String, Object> options;
    private final List<String> sitemap;
    private final List<Issue> issues;
    private final Map<String, Object> plugins;
    private final Instant startDatetime;
    private final Instant finishDatetime;
    private final Duration deltaTime;

    private AuditStore(Builder b) {
        this.version = b.version;
        this.revision = b.revision;
        this.options = (b.options == null) ? Map.of() : b.options;
        this.sitemap = (b.sitemap == null) ? List.of() : List.copyOf(b.sitemap);
        this.issues = (b.issues == null) ? List.of() : List.copyOf(b.issues);
        this.plugins = (b.plugins == null) ? Map.of() : b.plugins;
        this.startDatetime = b.startDatetime;
        this.finishDatetime = b.finishDatetime;
        this.deltaTime = b.deltaTime;
    }

    public String getVersion() { return version; }
    public String getRevision() { return revision; }
    public Map<String, Object> getOptions() { return options; }
    public List<String> getSitemap() { return sitemap; }
    public List<Issue> getIssues() { return issues; }
    public Map<String, Object> getPlugins() { return plugins; }
    public Instant getStartDatetime() { return startDatetime; }
    public Instant getFinishDatetime() { return finishDatetime; }
    public Duration getDeltaTime() { return deltaTime; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String version;
        private String revision;
        private Map<String, Object> options;
        private List<String> sitemap;
        private List<Issue> issues;
        private Map<String, Object> plugins;
        private Instant startDatetime;
        private Instant finishDatetime;
        private Duration deltaTime;

        public Builder version(String v) { this.version = v; return this; }
        public Builder revision(String r) { this.revision = r; return this; }
        public Builder options(Map<String, Object> o) { this.options = o; return this; }
        public Builder sitemap(List<String> s) { this.sitemap = s; return this; }
        public Builder issues(List<Issue> i) { this.issues = i; return this; }
        public Builder plugins(Map<String, Object> p) { this.plugins = p; return this; }
        public Builder startDatetime(Instant t) { this.startDatetime = t; return this; }
        public Builder finishDatetime(Instant t) { this.finishDatetime = t; return this; }
        public Builder deltaTime(Duration d) { this.deltaTime = d; return this; }

        public AuditStore build() { return new AuditStore(this); }
    }
}
