package com.auditflow.core.component;

import com.auditflow.core.util.RegexFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Function;

/**
 * 이름 붙은 컴포넌트 팩토리 레지스트리 + 로드된 인스턴스 관리.
 *  - available: 등록(register/discover)된 팩토리, 등록 순서 유지
 *  - loaded: load() 로 인스턴스화된 컴포넌트, 로드 순서 유지
 *  - load() 이름 규칙: "*" = 전부, "-name" = 제외, 그 외는 정확한 이름
 *
 * 스캔 시작 시 쓰이고, 이후 감사 루프 스레드와 통계 조회 스레드가 동시에 읽는다.
 */
public class ComponentManager<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ComponentManager.class);

    public static final String WILDCARD = "*";
    public static final String EXCLUDE_PREFIX = "-";

    protected final String kind;
    private final ScanContext ctx;
    private final Map<String, ComponentFactory<T>> available = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, T> loaded = Collections.synchronizedMap(new LinkedHashMap<>());

    public ComponentManager(String kind, ScanContext ctx) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public void register(ComponentFactory<T> factory) {
        Objects.requireNonNull(factory, "factory");
        ComponentFactory<T> prev = available.put(factory.info().name(), factory);
        if (prev != null) LOG.debug("Replaced {} factory: {}", kind, factory.info().name());
    }

    public void registerAll(Collection<? extends ComponentFactory<T>> factories) {
        if (factories == null) return;
        for (ComponentFactory<T> f : factories) register(f);
    }

    /**
     * ServiceLoader 로 ComponentProvider 를 찾아 selector 가 고른 팩토리를 등록.
     * @return 등록된 팩토리 수
     */
    public int discover(Function<ComponentProvider, List<ComponentFactory<T>>> selector, ClassLoader cl) {
        int n = 0;
        try {
            for (ComponentProvider p : ServiceLoader.load(ComponentProvider.class, cl)) {
                List<ComponentFactory<T>> found = selector.apply(p);
                if (found == null) continue;
                for (ComponentFactory<T> f : found) {
                    register(f);
                    n++;
                }
            }
        } catch (ServiceConfigurationError e) {
            LOG.warn("{} discovery failed: {}", kind, e.getMessage(), e);
        }
        LOG.debug("Discovered {} {} factory(ies)", n, kind);
        return n;
    }

    /** 등록된 이름 목록(등록 순서) */
    public List<String> available() {
        synchronized (available) {
            return new ArrayList<>(available.keySet());
        }
    }

    /** 로드된 이름 목록(로드 순서) */
    public List<String> loaded() {
        synchronized (loaded) {
            return new ArrayList<>(loaded.keySet());
        }
    }

    /**
     * 이름 목록을 해석해 인스턴스화. 이미 로드된 것은 건너뛴다.
     * @return 이번 호출로 새로 로드된 이름
     * @throws ComponentNotFoundException 등록되지 않은 이름
     */
    public List<String> load(List<String> names) {
        List<String> out = new ArrayList<>();
        for (String name : resolve(names)) {
            if (loaded.containsKey(name)) continue;
            T instance = available.get(name).create(ctx);
            loaded.put(name, Objects.requireNonNull(instance, () -> kind + " factory returned null: " + name));
            out.add(name);
        }
        if (!out.isEmpty()) LOG.info("Loaded {} {}(s): {}", out.size(), kind, out);
        return out;
    }

    List<String> resolve(List<String> names) {
        if (names == null || names.isEmpty()) return List.of();

        Set<String> excluded = new LinkedHashSet<>();
        Set<String> wanted = new LinkedHashSet<>();
        boolean all = false;
        for (String raw : names) {
            if (raw == null || raw.isBlank()) continue;
            String n = raw.trim();
            if (n.equals(WILDCARD)) {
                all = true;
            } else if (n.startsWith(EXCLUDE_PREFIX)) {
                excluded.add(n.substring(EXCLUDE_PREFIX.length()));
            } else {
                if (!available.containsKey(n)) throw new ComponentNotFoundException(kind, n);
                wanted.add(n);
            }
        }
        if (all) {
            Set<String> everything = new LinkedHashSet<>(available());
            everything.addAll(wanted);
            wanted = everything;
        }
        wanted.removeAll(excluded);
        return new ArrayList<>(wanted);
    }

    public T get(String name) {
        return loaded.get(name);
    }

    public ComponentInfo info(String name) {
        ComponentFactory<T> f = available.get(name);
        if (f == null) throw new ComponentNotFoundException(kind, name);
        return f.info();
    }

    public String nameToPath(String name) {
        return info(name).path();
    }

    /** 등록된 컴포넌트 중 경로가 모든 필터에 매칭되는 것의 정보 */
    public List<ComponentInfo> list(List<String> pathFilters) {
        List<ComponentInfo> out = new ArrayList<>();
        for (String name : available()) {
            ComponentInfo info = info(name);
            if (RegexFilters.allMatch(pathFilters, info.path())) out.add(info);
        }
        return out;
    }

    /** 로드된 컴포넌트가 없으면 true */
    public boolean isEmpty() {
        return loaded.isEmpty();
    }

    /** 로드 해제(등록된 팩토리는 유지) */
    public void clear() {
        loaded.clear();
    }

    /** 로드된 인스턴스 스냅샷(로드 순서) */
    protected Map<String, T> loadedComponents() {
        synchronized (loaded) {
            return new LinkedHashMap<>(loaded);
        }
    }
}
