package com.auditflow.core.report;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 리포트 파일 경로 규칙: {outputDir}/reports/{host}/scan-{slug}-{yyyyMMdd-HHmmss}.{ext} */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public static Path reportPath(Path outputDir, String target, Instant startedAt, String ext) {
        Path base = (outputDir == null ? Path.of("out") : outputDir);
        Instant ts = (startedAt == null ? Instant.now() : startedAt);
        return base.resolve("reports").resolve(host(target))
                .resolve("scan-" + slug(target) + "-" + TS_FMT.format(ts) + "." + ext);
    }

    static String host(String target) {
        try {
            String h = URI.create(target).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException | NullPointerException e) {
            return "unknown-host";
        }
    }

    static String slug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("-{2,}", "-").replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
