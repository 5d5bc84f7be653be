package com.auditflow.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 중복 URL 필터 규칙: pattern 에 매칭되는 URL 은 count 번까지만 크롤 대상으로 허용.
 * 카운터는 스캔 도중 소모되므로 리포트용 원본은 별도 스냅샷으로 보관한다.
 */
public final class RedundancyRule {
    private final String pattern;
    private final Pattern compiled;
    private int count;

    public RedundancyRule(String pattern, int count) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.compiled = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        this.count = Math.max(0, count);
    }

    public String getPattern() { return pattern; }
    public synchronized int getCount() { return count; }

    public boolean matches(String url) {
        return url != null && compiled.matcher(url).find();
    }

    /** 남은 허용치가 있으면 1 소모하고 true */
    public synchronized boolean tryConsume() {
        if (count <= 0) return false;
        count--;
        return true;
    }

    public synchronized RedundancyRule copy() {
        return new RedundancyRule(pattern, count);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("pattern", pattern);
        m.put("count", getCount());
        return m;
    }

    public static List<RedundancyRule> deepCopy(List<RedundancyRule> rules) {
        List<RedundancyRule> out = new ArrayList<>();
        if (rules != null) for (RedundancyRule r : rules) out.add(r.copy());
        return out;
    }

    public static List<Map<String, Object>> toMaps(List<RedundancyRule> rules) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (rules != null) for (RedundancyRule r : rules) out.add(r.toMap());
        return out;
    }
}
