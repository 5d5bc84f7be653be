package com.auditflow.core.model;

import java.time.Instant;
import java.util.Objects;

/** 모듈이 보고한 단일 발견 사항 */
public final class Issue {
    private final String module;
    private final String name;
    private final String url;
    private final String element;     // form / link / header / cookie 등
    private final String variable;    // 대상 파라미터명(없으면 null)
    private final Severity severity;
    private final String description;
    private final String evidence;
    private final Instant detectedAt;

    private Issue(Builder b) {
        this.module = b.module;
        this.name = b.name;
        this.url = b.url;
        this.element = b.element;
        this.variable = b.variable;
        this.severity = b.severity;
        this.description = b.description;
        this.evidence = b.evidence;
        this.detectedAt = (b.detectedAt == null ? Instant.now() : b.detectedAt);
    }

    public String getModule() { return module; }
    public String getName() { return name; }
    public String getUrl() { return url; }
    public String getElement() { return element; }
    public String getVariable() { return variable; }
    public Severity getSeverity() { return severity; }
    public String getDescription() { return description; }
    public String getEvidence() { return evidence; }
    public Instant getDetectedAt() { return detectedAt; }

    /** 중복 억제 키: module|name|url|element|variable */
    public String uniqueKey() {
        return module + "|" + name + "|" + url + "|" + (element == null ? "-" : element)
                + "|" + (variable == null ? "-" : variable);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String module;
        private String name;
        private String url;
        private String element;
        private String variable;
        private Severity severity = Severity.INFORMATIONAL;
        private String description;
        private String evidence;
        private Instant detectedAt;

        public Builder module(String module) { this.module = module; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder element(String element) { this.element = element; return this; }
        public Builder variable(String variable) { this.variable = variable; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder evidence(String evidence) { this.evidence = evidence; return this; }
        public Builder detectedAt(Instant detectedAt) { this.detectedAt = detectedAt; return this; }

        public Issue build() {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(severity, "severity");
            return new Issue(this);
        }
    }
}
