package com.auditflow.core.component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 컴포넌트 메타데이터.
 *
 * @param name     로드/제외에 쓰는 짧은 이름
 * @param path     목록 필터(lsmod 등)가 매칭하는 경로, 예: "modules/audit/xss"
 * @param priority 작을수록 먼저 실행(같으면 로드 순서)
 */
public record ComponentInfo(String name,
                            String description,
                            List<String> authors,
                            String version,
                            String path,
                            int priority) {

    public ComponentInfo {
        Objects.requireNonNull(name, "name");
        if (name.isBlank() || name.startsWith("-") || name.equals("*")) {
            throw new IllegalArgumentException("invalid component name: " + name);
        }
        description = (description == null) ? "" : description;
        authors = (authors == null) ? List.of() : List.copyOf(authors);
        version = (version == null) ? "0.1" : version;
        path = (path == null || path.isBlank()) ? name : path;
    }

    public static ComponentInfo of(String name, String path) {
        return new ComponentInfo(name, null, null, null, path, 0);
    }

    public ComponentInfo withPriority(int p) {
        return new ComponentInfo(name, description, authors, version, path, p);
    }

    /** 목록 조회 응답용 */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("description", description);
        m.put("authors", authors);
        m.put("version", version);
        m.put("path", path);
        m.put("priority", priority);
        return m;
    }
}
