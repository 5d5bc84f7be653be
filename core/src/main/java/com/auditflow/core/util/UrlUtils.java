package com.auditflow.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-domain 판정 + 상대경로 절대화 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    public static boolean sameDomain(String a, String b) {
        try {
            return sameDomain(URI.create(a), URI.create(b));
        } catch (IllegalArgumentException | NullPointerException e) {
            return false;
        }
    }

    /**
     * ref 를 base 기준 절대 URL 로 바꾼 뒤 정규화.
     * 해석할 수 없거나 host 가 없으면 null.
     */
    public static String toAbsolute(String ref, String base) {
        if (ref == null || ref.isBlank()) return null;
        try {
            URI r = new URI(ref.trim());
            URI resolved;
            if (r.isAbsolute() || base == null) {
                resolved = r;
            } else {
                // "http://h" 처럼 경로가 빈 base 는 먼저 "/" 를 붙여야 resolve 가 올바르다
                resolved = normalize(new URI(base.trim())).resolve(r);
            }
            if (!resolved.isAbsolute() || resolved.getHost() == null) return null;
            String scheme = resolved.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) return null;
            return normalize(resolved).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
