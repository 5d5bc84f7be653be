package com.auditflow.core.util;

import java.util.List;
import java.util.regex.Pattern;

/** 목록 조회용 정규식 필터: 모든 패턴이 매칭되어야 통과, 비어 있으면 전부 통과 */
public final class RegexFilters {
    private RegexFilters() {}

    /**
     * @throws java.util.regex.PatternSyntaxException 잘못된 정규식
     */
    public static boolean allMatch(List<String> patterns, String value) {
        if (patterns == null || patterns.isEmpty()) return true;
        if (value == null) return false;
        for (String p : patterns) {
            if (p == null || p.isEmpty()) continue;
            if (!Pattern.compile(p, Pattern.CASE_INSENSITIVE).matcher(value).find()) return false;
        }
        return true;
    }
}
