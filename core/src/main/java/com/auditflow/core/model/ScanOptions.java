package com.auditflow.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 스캔 옵션 (scan.yml 매핑 대상).
 * 설정값 + 실행 중 기록되는 시각(start/finish/delta)을 함께 보관한다.
 * 오케스트레이터 reset 시에도 이 객체 자체는 그대로 유지된다.
 */
public final class ScanOptions {

    // ---------- 대상/범위 ----------
    private String target;                                  // 시작 URL (필수)
    private List<String> restrictPaths = new ArrayList<>(); // 지정 시 스파이더 생략
    private int maxDepth = 3;
    private boolean sameDomainOnly = true;
    private List<RedundancyRule> redundant = new ArrayList<>();

    // ---------- 감사 동작 ----------
    private boolean excludeBinaries = false;
    private boolean onlyPositives = false;

    // ---------- 컴포넌트 (이름 목록, "*" 와 "-name" 지원) ----------
    private List<String> modules = new ArrayList<>(List.of("*"));
    private List<String> plugins = new ArrayList<>();
    private List<String> reports = new ArrayList<>();

    // ---------- 목록 조회 필터(정규식, 모두 매칭되어야 통과) ----------
    private List<String> lsmod = new ArrayList<>();
    private List<String> lsplug = new ArrayList<>();
    private List<String> lsrep = new ArrayList<>();

    // ---------- HTTP ----------
    private Duration timeout = Duration.ofSeconds(10);
    private int httpConcurrency = 20;
    private boolean followRedirects = true;
    private String userAgent = "AuditFlow/0.3";

    // ---------- 세션 ----------
    private String loginCheckUrl;
    private String loginCheckPattern;

    // ---------- 출력 ----------
    private Path outputDir = Path.of("out");

    // ---------- 실행 시각(런타임 기록) ----------
    private volatile Instant startDatetime;
    private volatile Instant finishDatetime;
    private volatile Duration deltaTime;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public List<String> getRestrictPaths() { return restrictPaths; }
    public int getMaxDepth() { return maxDepth; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public List<RedundancyRule> getRedundant() { return redundant; }
    public boolean isExcludeBinaries() { return excludeBinaries; }
    public boolean isOnlyPositives() { return onlyPositives; }
    public List<String> getModules() { return modules; }
    public List<String> getPlugins() { return plugins; }
    public List<String> getReports() { return reports; }
    public List<String> getLsmod() { return lsmod; }
    public List<String> getLsplug() { return lsplug; }
    public List<String> getLsrep() { return lsrep; }
    public Duration getTimeout() { return timeout; }
    public int getHttpConcurrency() { return httpConcurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public String getLoginCheckUrl() { return loginCheckUrl; }
    public String getLoginCheckPattern() { return loginCheckPattern; }
    public Path getOutputDir() { return outputDir; }
    public Instant getStartDatetime() { return startDatetime; }
    public Instant getFinishDatetime() { return finishDatetime; }
    public Duration getDeltaTime() { return deltaTime; }

    // ---------- fluent setters ----------
    public ScanOptions setTarget(String target) { this.target = target; return this; }
    public ScanOptions setRestrictPaths(List<String> paths) {
        this.restrictPaths = (paths == null) ? new ArrayList<>() : new ArrayList<>(paths);
        return this;
    }
    public ScanOptions setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public ScanOptions setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }
    public ScanOptions setRedundant(List<RedundancyRule> rules) {
        this.redundant = (rules == null) ? new ArrayList<>() : new ArrayList<>(rules);
        return this;
    }
    public ScanOptions setExcludeBinaries(boolean v) { this.excludeBinaries = v; return this; }
    public ScanOptions setOnlyPositives(boolean v) { this.onlyPositives = v; return this; }
    public ScanOptions setModules(List<String> names) { this.modules = copy(names); return this; }
    public ScanOptions setPlugins(List<String> names) { this.plugins = copy(names); return this; }
    public ScanOptions setReports(List<String> names) { this.reports = copy(names); return this; }
    public ScanOptions setLsmod(List<String> filters) { this.lsmod = copy(filters); return this; }
    public ScanOptions setLsplug(List<String> filters) { this.lsplug = copy(filters); return this; }
    public ScanOptions setLsrep(List<String> filters) { this.lsrep = copy(filters); return this; }
    public ScanOptions setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScanOptions setHttpConcurrency(int c) { this.httpConcurrency = Math.max(1, c); return this; }
    public ScanOptions setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanOptions setUserAgent(String ua) { this.userAgent = ua; return this; }
    public ScanOptions setLoginCheckUrl(String url) { this.loginCheckUrl = url; return this; }
    public ScanOptions setLoginCheckPattern(String p) { this.loginCheckPattern = p; return this; }
    public ScanOptions setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public ScanOptions setStartDatetime(Instant t) { this.startDatetime = t; return this; }
    public ScanOptions setFinishDatetime(Instant t) { this.finishDatetime = t; return this; }
    public ScanOptions setDeltaTime(Duration d) { this.deltaTime = d; return this; }

    public ScanOptions setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** 실행 시각 기록만 초기화(설정값은 유지) */
    public void clearRuntimeStamps() {
        this.startDatetime = null;
        this.finishDatetime = null;
        this.deltaTime = null;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (httpConcurrency < 1) throw new IllegalArgumentException("httpConcurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(restrictPaths, "restrictPaths");
        Objects.requireNonNull(redundant, "redundant");
        Objects.requireNonNull(outputDir, "outputDir");
        if (loginCheckUrl != null && (loginCheckPattern == null || loginCheckPattern.isBlank()))
            throw new IllegalArgumentException("loginCheckPattern is required when loginCheckUrl is set");
    }

    public static ScanOptions defaults() { return new ScanOptions(); }

    /**
     * 스냅샷/리포트용 평면 맵(깊은 복사). 이후 옵션이 바뀌어도 영향을 받지 않는다.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("target", target);
        m.put("restrictPaths", List.copyOf(restrictPaths));
        m.put("maxDepth", maxDepth);
        m.put("sameDomainOnly", sameDomainOnly);
        m.put("redundant", RedundancyRule.toMaps(redundant));
        m.put("excludeBinaries", excludeBinaries);
        m.put("onlyPositives", onlyPositives);
        m.put("modules", List.copyOf(modules));
        m.put("plugins", List.copyOf(plugins));
        m.put("reports", List.copyOf(reports));
        m.put("timeoutMs", timeout == null ? null : timeout.toMillis());
        m.put("httpConcurrency", httpConcurrency);
        m.put("followRedirects", followRedirects);
        m.put("userAgent", userAgent);
        m.put("loginCheckUrl", loginCheckUrl);
        m.put("outputDir", outputDir == null ? null : outputDir.toString());
        m.put("startDatetime", startDatetime == null ? null : startDatetime.toString());
        m.put("finishDatetime", finishDatetime == null ? null : finishDatetime.toString());
        m.put("deltaTimeMs", deltaTime == null ? null : deltaTime.toMillis());
        return m;
    }

    private static List<String> copy(List<String> in) {
        return (in == null) ? new ArrayList<>() : new ArrayList<>(in);
    }
}
