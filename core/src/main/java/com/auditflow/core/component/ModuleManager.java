package com.auditflow.core.component;

import com.auditflow.core.model.Issue;
import com.auditflow.core.model.Page;
import com.auditflow.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 감사 모듈 레지스트리.
 *  - schedule(): 매 페이지마다 다시 읽는 실행 순서(priority 오름차순, 같으면 로드 순서)
 *  - runOne(): 모듈 1회 실행, 예외는 ModuleOutcome 으로 격리
 *  - results(): uniqueKey 기준 중복 제거된 발견 사항
 */
public final class ModuleManager extends ComponentManager<AuditModule> {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleManager.class);
    private static final StructuredLog SLOG = StructuredLog.get(ModuleManager.class);

    private final Map<String, Issue> results = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<ModuleOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());

    public ModuleManager(ScanContext ctx) {
        super("module", ctx);
    }

    public List<String> schedule() {
        List<String> names = loaded();
        // List.sort 는 stable
        names.sort(Comparator.comparingInt(n -> info(n).priority()));
        return names;
    }

    public ModuleOutcome runOne(String name, Page page) {
        final String url = page.getUrl();
        AuditModule module = get(name);
        if (module == null) {
            LOG.warn("Module {} is not loaded, skipping {}", name, url);
            ModuleOutcome oc = ModuleOutcome.failed(name, url, 0, new ComponentNotFoundException(kind, name));
            outcomes.add(oc);
            return oc;
        }

        long t0 = System.nanoTime();
        ModuleOutcome oc;
        try {
            module.run(page);
            oc = ModuleOutcome.ok(name, url, elapsedMs(t0));
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            LOG.warn("Module {} failed on {}", name, url, e);
            SLOG.warn("module-fault", "module", name, "url", url, "error", e.toString());
            oc = ModuleOutcome.failed(name, url, elapsedMs(t0), e);
        }
        outcomes.add(oc);
        return oc;
    }

    /** 같은 uniqueKey 는 처음 것만 유지 */
    public void register(Issue issue) {
        if (issue == null) return;
        results.putIfAbsent(issue.uniqueKey(), issue);
    }

    public List<Issue> results() {
        synchronized (results) {
            return new ArrayList<>(results.values());
        }
    }

    public List<ModuleOutcome> outcomes() {
        synchronized (outcomes) {
            return new ArrayList<>(outcomes);
        }
    }

    public List<ModuleOutcome> faults() {
        List<ModuleOutcome> out = new ArrayList<>();
        for (ModuleOutcome oc : outcomes()) if (!oc.isOk()) out.add(oc);
        return out;
    }

    @Override
    public void clear() {
        super.clear();
        results.clear();
        outcomes.clear();
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }
}
