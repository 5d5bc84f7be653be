package com.auditflow.core.component;

import com.auditflow.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 플러그인 레지스트리. run() 은 각 플러그인을 별도 스레드에서 시작만 하고 반환,
 * block() 이 전부 끝나길 기다린 뒤 결과를 모은다.
 */
public final class PluginManager extends ComponentManager<Plugin> {

    private static final Logger LOG = LoggerFactory.getLogger(PluginManager.class);

    private final Map<String, Future<?>> running = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Object> results = Collections.synchronizedMap(new LinkedHashMap<>());
    private ExecutorService exec; // guarded by this

    public PluginManager(ScanContext ctx) {
        super("plugin", ctx);
    }

    public synchronized void run() {
        Map<String, Plugin> plugins = loadedComponents();
        if (plugins.isEmpty()) return;
        if (exec == null) exec = Executors.newCachedThreadPool(new NamedThreadFactory("af-plugin"));

        for (Map.Entry<String, Plugin> e : plugins.entrySet()) {
            if (running.containsKey(e.getKey())) continue;
            Plugin p = e.getValue();
            running.put(e.getKey(), exec.submit(() -> {
                p.run();
                return null;
            }));
        }
        LOG.info("Started {} plugin(s)", plugins.size());
    }

    /** 실행 중인 플러그인이 모두 끝날 때까지 대기 후 결과 수집 */
    public void block() {
        Map<String, Future<?>> futures;
        synchronized (running) {
            futures = new LinkedHashMap<>(running);
        }
        for (Map.Entry<String, Future<?>> e : futures.entrySet()) {
            try {
                e.getValue().get();
            } catch (CancellationException ce) {
                LOG.debug("Plugin {} was cancelled", e.getKey());
            } catch (ExecutionException ex) {
                Throwable cause = (ex.getCause() != null ? ex.getCause() : ex);
                LOG.warn("Plugin {} failed: {}", e.getKey(), cause.toString(), cause);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for plugins");
            }
        }

        for (Map.Entry<String, Plugin> e : loadedComponents().entrySet()) {
            try {
                Object r = e.getValue().results();
                if (r != null) results.put(e.getKey(), r);
                e.getValue().cleanUp();
            } catch (RuntimeException ex) {
                LOG.warn("Plugin {} clean-up failed", e.getKey(), ex);
            }
        }
        running.clear();
        shutdown(false);
    }

    public boolean isBusy() {
        synchronized (running) {
            return running.values().stream().anyMatch(f -> !f.isDone());
        }
    }

    public Map<String, Object> results() {
        synchronized (results) {
            return new LinkedHashMap<>(results);
        }
    }

    /** 실행 중인 플러그인은 인터럽트하고 로드/결과를 비운다 */
    @Override
    public void clear() {
        synchronized (running) {
            for (Future<?> f : running.values()) f.cancel(true);
            running.clear();
        }
        shutdown(true);
        results.clear();
        super.clear();
    }

    private synchronized void shutdown(boolean now) {
        if (exec == null) return;
        if (now) exec.shutdownNow(); else exec.shutdown();
        exec = null;
    }
}
