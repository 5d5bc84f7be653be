package com.auditflow.core.util;

import com.auditflow.core.model.RedundancyRule;
import com.auditflow.core.model.ScanOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * scan.yml 을 읽어 ScanOptions 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * restrictPaths: ["/a", "/b"]      # 지정 시 스파이더 생략
 * excludeBinaries: true
 * onlyPositives: false
 * scope:
 *   maxDepth: 3
 *   sameDomainOnly: true
 *   redundant:
 *     - { pattern: "calendar\\.php", count: 5 }
 * http:
 *   timeoutMs: 10000
 *   concurrency: 20
 *   followRedirects: true
 *   userAgent: "AuditFlow/0.3"
 * session:
 *   loginCheckUrl: "https://example.com/account"
 *   loginCheckPattern: "Logout"
 * output:
 *   dir: "out"
 * components:
 *   modules: ["*", "-slow_module"]
 *   plugins: []
 *   reports: ["json", "summary"]
 *   lsmod: ["audit"]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanOptions loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static ScanOptions load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ScanOptions load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ScanOptions opts = ScanOptions.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            opts.validate();
            return opts;
        }

        // 1) 평면 키
        setString(map, "target", opts::setTarget);
        setStringList(map, "restrictPaths", opts::setRestrictPaths);
        setBoolean(map, "excludeBinaries", opts::setExcludeBinaries);
        setBoolean(map, "onlyPositives", opts::setOnlyPositives);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", opts::setMaxDepth);
            setBoolean(scope, "sameDomainOnly", opts::setSameDomainOnly);
            setRedundant(scope, opts);
        }

        // 3) http.*
        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            setIntAsDurationMs(http, "timeoutMs", opts::setTimeout);
            setInt(http, "concurrency", opts::setHttpConcurrency);
            setBoolean(http, "followRedirects", opts::setFollowRedirects);
            setString(http, "userAgent", opts::setUserAgent);
        }

        // 4) session.*
        Map<String, Object> session = getMap(map, "session");
        if (session != null) {
            setString(session, "loginCheckUrl", opts::setLoginCheckUrl);
            setString(session, "loginCheckPattern", opts::setLoginCheckPattern);
        }

        // 5) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            Object dir = output.get("dir");
            if (dir != null) opts.setOutputDir(Path.of(String.valueOf(dir)));
        }

        // 6) components.*
        Map<String, Object> comps = getMap(map, "components");
        if (comps != null) {
            setStringList(comps, "modules", opts::setModules);
            setStringList(comps, "plugins", opts::setPlugins);
            setStringList(comps, "reports", opts::setReports);
            setStringList(comps, "lsmod", opts::setLsmod);
            setStringList(comps, "lsplug", opts::setLsplug);
            setStringList(comps, "lsrep", opts::setLsrep);
        }

        opts.validate();
        return opts;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setRedundant(Map<?, ?> scope, ScanOptions opts) {
        Object v = scope.get("redundant");
        if (!(v instanceof List<?> list)) return;
        List<RedundancyRule> rules = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> m)) continue;
            Object pattern = m.get("pattern");
            if (pattern == null) continue;
            Object count = m.get("count");
            int c = (count instanceof Number n) ? n.intValue()
                    : (count == null ? 0 : Integer.parseInt(String.valueOf(count).trim()));
            rules.add(new RedundancyRule(String.valueOf(pattern), c));
        }
        opts.setRedundant(rules);
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }
}
